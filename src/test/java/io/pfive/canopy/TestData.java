// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy;

import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.membership.TileLayer;
import io.pfive.canopy.membership.TileSelector;
import io.pfive.canopy.raster.GeoTiffStore;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.GridSpec;
import io.pfive.canopy.stage.StagingLayout;
import io.pfive.canopy.store.FileStore;
import io.pfive.canopy.vector.Feature;
import io.pfive.canopy.vector.FeatureLayer;
import io.pfive.canopy.vector.GeoJsonLayers;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/// A small synthetic study area in one projected coordinate system, with 1 meter cells so that
/// cell edges fall on whole coordinates.
///
/// Regions: 1 "Ozark Highlands" covering x 0..18, 2 "Delta-Plain" covering x 25..45, and 12 "Far
/// Away" with no tiles, all with y 0..10. Tiles: A at x 0..10 and B at x 10..20 in region 1, C at
/// x 30..40 in region 2, and D at x 200..210 in no region. Imagery extends one cell beyond each
/// footprint on every side, so neighboring reprojected tiles overlap.
public class TestData {

    public static final String CRS = "EPSG:5070";
    public static final int YEAR = 2014;

    public static final String TILE_A = "m_3608906_ne_15_1_20140527_20141001.tif";
    public static final String TILE_B = "m_3608906_nw_15_1_20140527_20141001.tif";
    public static final String TILE_C = "m_3608907_ne_15_1_20140612_20141001.tif";
    public static final String TILE_D = "m_3609001_se_15_1_20140612_20141001.tif";
    /// An index row in region 1 that does not name NAIP imagery.
    public static final String FOREIGN_TILE = "ortho_1-1_1n_s_ar001_2014_1.tif";

    /// Value of band b of every imagery cell. Nonzero, since zero is the imagery fill value.
    public static int imageryValue (int band) {
        return 10 * band + 7;
    }

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    public final Path root;
    public final Path naipRoot;
    public final Path resultsRoot;
    public final Path regionLayerPath;
    public final Path tileLayerPath;
    public final Path snapRaster;
    public final GeoTiffStore store = new GeoTiffStore(CRS);

    public TestData (Path root) {
        this.root = root;
        this.naipRoot = root.resolve("naip");
        this.resultsRoot = root.resolve("results");
        this.regionLayerPath = root.resolve("regions.geojson");
        this.tileLayerPath = root.resolve("tiles.geojson");
        this.snapRaster = root.resolve("snap").resolve("rm_3608906_ne_15_1_20140527.tif");
    }

    /// Write both layers, with membership already assigned, and imagery for every tile.
    public static TestData standard (Path root) {
        TestData data = new TestData(root);
        data.writeRegions();
        data.writeTiles(true);
        data.writeAllImagery();
        return data;
    }

    public static Polygon box (double xMin, double yMin, double xMax, double yMax) {
        return (Polygon) GEOMETRY_FACTORY.toGeometry(new Envelope(xMin, xMax, yMin, yMax));
    }

    public static Polygon footprint (String tileFileName) {
        return switch (tileFileName) {
            case TILE_A -> box(0, 0, 10, 10);
            case TILE_B -> box(10, 0, 20, 10);
            case TILE_C -> box(30, 0, 40, 10);
            case TILE_D -> box(200, 0, 210, 10);
            case FOREIGN_TILE -> box(4, 2, 8, 6);
            default -> throw new IllegalArgumentException(tileFileName);
        };
    }

    public void writeRegions () {
        FeatureLayer layer = new FeatureLayer("regions", CRS, List.of("PHYSIO_ID", "NAME"));
        layer.add(feature(box(0, 0, 18, 10), Map.of("PHYSIO_ID", 1, "NAME", "Ozark Highlands")));
        layer.add(feature(box(25, 0, 45, 10), Map.of("PHYSIO_ID", 2, "NAME", "Delta-Plain")));
        layer.add(feature(box(100, 0, 110, 10), Map.of("PHYSIO_ID", 12, "NAME", "Far Away")));
        GeoJsonLayers.write(layer, regionLayerPath);
    }

    public void writeTiles (boolean withMembership) {
        writeTiles(withMembership, List.of(TILE_A, TILE_B, TILE_C, TILE_D), List.of(",1,", ",1,", ",2,", ","));
    }

    /// The standard tiles plus the foreign one, all with membership.
    public void writeTilesWithForeignName () {
        writeTiles(true, List.of(TILE_A, TILE_B, TILE_C, TILE_D, FOREIGN_TILE),
              List.of(",1,", ",1,", ",2,", ",", ",1,"));
    }

    private void writeTiles (boolean withMembership, List<String> names, List<String> membership) {
        List<String> fields = new ArrayList<>(List.of("OBJECTID", "FileName"));
        if (withMembership) fields.add("PHYREGS");
        FeatureLayer layer = new FeatureLayer("tiles", CRS, fields);
        for (int i = 0; i < names.size(); i++) {
            Feature feature = new Feature(footprint(names.get(i)));
            feature.set("OBJECTID", 101 + i);
            feature.set("FileName", names.get(i));
            if (withMembership) feature.set("PHYREGS", membership.get(i));
            layer.add(feature);
        }
        GeoJsonLayers.write(layer, tileLayerPath);
    }

    public void writeAllImagery () {
        for (String name : List.of(TILE_A, TILE_B, TILE_C, TILE_D)) {
            writeImagery(name);
        }
    }

    /// Four band imagery covering the tile footprint plus one cell all around.
    public void writeImagery (String tileFileName) {
        Tile tile = new Tile(0, tileFileName, footprint(tileFileName), null);
        Envelope env = tile.footprint().getEnvelopeInternal();
        GridSpec grid = new GridSpec(CRS, env.getMinX() - 1, env.getMaxY() + 1, 1, 1,
              (int) env.getWidth() + 2, (int) env.getHeight() + 2);
        GridRaster imagery = GridRaster.create(grid, 4, null);
        for (int b = 0; b < 4; b++) {
            Arrays.fill(imagery.band(b), (short) imageryValue(b));
        }
        store.write(imagery, layout().sourceImagery(tile), "test imagery");
    }

    public Properties properties () {
        Properties properties = new Properties();
        properties.setProperty("region-layer", regionLayerPath.toString());
        properties.setProperty("tile-layer", tileLayerPath.toString());
        properties.setProperty("naip-path", naipRoot.toString());
        properties.setProperty("target-crs", CRS);
        properties.setProperty("snap-raster", snapRaster.toString());
        properties.setProperty("results-path", resultsRoot.toString());
        properties.setProperty("analysis-year", Integer.toString(YEAR));
        properties.setProperty("random-seed", "42");
        return properties;
    }

    public Configuration configuration () {
        return Configuration.fromProperties(properties());
    }

    public StagingLayout layout () {
        return new StagingLayout(naipRoot, resultsRoot, YEAR);
    }

    public RegionLayer regionLayer () {
        return new RegionLayer(regionLayerPath, "PHYSIO_ID", "NAME", "AREA_SQKM", CRS);
    }

    public TileLayer tileLayer () {
        return new TileLayer(tileLayerPath, "FileName", "PHYREGS", CRS);
    }

    public TileSelector tileSelector () {
        return new TileSelector(tileLayer());
    }

    public Region region (int id) {
        return regionLayer().region(id).orElseThrow();
    }

    public Tile tile (String tileFileName) {
        return tileLayer().tiles().stream()
              .filter(t -> t.fileName().equals(tileFileName))
              .findFirst().orElseThrow();
    }

    /// Classification polygons for a tile, in the region's Outputs folder where the classification
    /// tool would leave them. Each polygon is canopy.
    public Path writePolygonClassification (Region region, Tile tile, Geometry... canopy) {
        FeatureLayer layer = new FeatureLayer("classes", CRS, List.of("CLASS_ID"));
        for (Geometry geometry : canopy) {
            layer.add(feature(geometry, Map.of("CLASS_ID", 1)));
        }
        String base = "r" + tile.sourceFileName().replace(".tif", "");
        Path path = layout().outputsDir(region).resolve(base + ".geojson");
        FileStore.createDirectories(path.getParent());
        GeoJsonLayers.write(layer, path);
        return path;
    }

    /// A classification raster in the tool's own codes, on the grid of the tile's imagery.
    public Path writeRasterClassification (Region region, Tile tile, int transitionalValue) {
        GridSpec grid = store.readGrid(layout().sourceImagery(tile));
        Path path = layout().outputsDir(region).resolve("r" + tile.sourceFileName());
        store.write(filled(grid, transitionalValue, null), path, "test classification");
        return path;
    }

    public static GridRaster filled (GridSpec grid, int value, Integer noData) {
        GridRaster raster = GridRaster.create(grid, 1, noData);
        Arrays.fill(raster.band(0), (short) value);
        return raster;
    }

    private static Feature feature (Geometry geometry, Map<String, Object> properties) {
        Feature feature = new Feature(geometry);
        properties.forEach(feature::set);
        return feature;
    }

}
