// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.vector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GeoJsonLayersTest {

    @TempDir
    Path tempDir;

    @Test
    void schemaSurvivesFeaturesWithoutValues () {
        FeatureLayer layer = new FeatureLayer("points", "epsg:5070", List.of("GT_2014", "GT_2016"));
        Feature feature = new Feature(new GeometryFactory().createPoint(new Coordinate(1.5, 2.5)));
        feature.set("GT_2014", 1);
        layer.add(feature);
        Path path = tempDir.resolve("points.geojson");
        GeoJsonLayers.write(layer, path);

        FeatureLayer read = GeoJsonLayers.read(path);
        assertEquals("points", read.name);
        assertEquals("EPSG:5070", read.crs);
        assertEquals(List.of("GT_2014", "GT_2016"), read.fields());
        Feature first = read.features().get(0);
        assertEquals(1, first.get("GT_2014"));
        assertNull(first.get("GT_2016"));
        assertEquals(1.5, first.geometry.getCoordinate().x, 1e-9);
    }

    @Test
    void plainGeoJsonFromOtherTools () throws IOException {
        Path path = tempDir.resolve("tiles.geojson");
        Files.writeString(path, """
              {"type": "FeatureCollection",
               "crs": {"type": "name", "properties": {"name": "urn:ogc:def:crs:EPSG::26915"}},
               "features": [
                 {"type": "Feature", "properties": {"FileName": "m_3608906_ne_15_1_20140527_20141001.tif", "OBJECTID": 5},
                  "geometry": {"type": "Polygon", "coordinates": [[[0, 0], [1, 0], [1, 1], [0, 0]]]}},
                 {"type": "Feature", "properties": {"PHYREGS": ",3,", "OBJECTID": 6}, "geometry": null}
               ]}
              """);
        FeatureLayer layer = GeoJsonLayers.read(path);
        assertEquals("tiles", layer.name);
        assertEquals("EPSG:26915", layer.crs);
        assertEquals(List.of("FileName", "OBJECTID", "PHYREGS"), layer.fields());
        assertNull(layer.features().get(0).get("PHYREGS"));
        assertNull(layer.features().get(1).geometry);
        assertEquals(6, layer.features().get(1).getNumber("OBJECTID").intValue());
    }

    @Test
    void ogcNames () {
        assertEquals("EPSG:5070", GeoJsonLayers.fromOgcUrn("urn:ogc:def:crs:EPSG::5070"));
        assertEquals("EPSG:4326", GeoJsonLayers.fromOgcUrn("urn:ogc:def:crs:OGC:1.3:CRS84"));
        assertEquals("EPSG:26915", GeoJsonLayers.fromOgcUrn("EPSG:26915"));
    }

    @Test
    void missingFieldIsASchemaError () {
        FeatureLayer layer = new FeatureLayer("tiles", "EPSG:5070", List.of("FileName"));
        SchemaException e = assertThrows(SchemaException.class, () -> layer.requireField("PHYREGS"));
        assertEquals("tiles", e.layer);
        assertEquals("PHYREGS", e.field);
    }

    @Test
    void textNumbersAreAccepted () {
        Feature feature = new Feature(null);
        feature.set("AREA", " 12.5 ");
        feature.set("BAD", "twelve");
        assertEquals(12.5, feature.getNumber("AREA").doubleValue(), 1e-12);
        assertNull(feature.getNumber("MISSING"));
        assertThrows(IllegalArgumentException.class, () -> feature.getNumber("BAD"));
    }

}
