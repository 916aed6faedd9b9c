// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import io.pfive.canopy.Configuration;
import io.pfive.canopy.geo.GeometryReprojector;
import io.pfive.canopy.vector.Feature;
import io.pfive.canopy.vector.FeatureLayer;
import io.pfive.canopy.vector.GeoJsonLayers;
import io.pfive.canopy.vector.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// The NAIP quarter-quadrangle index layer: one footprint per imagery tile, with the tile's file name
/// and, once the membership index has been built, the regions it intersects. Footprints are
/// transformed into the analysis coordinate system on load.
///
/// Tiles are identified by the OBJECTID attribute where the layer has one (as layers exported from
/// a geodatabase do), otherwise by their one-based position in the layer.
public class TileLayer {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String OBJECT_ID_FIELD = "OBJECTID";

    public final Path path;
    public final String fileNameField;
    public final String regionsField;
    private final FeatureLayer layer;
    private final List<Tile> tiles = new ArrayList<>();

    public TileLayer (Configuration config) {
        this(config.tileLayer, config.tileFileNameField, config.tileRegionsField, config.targetCrs);
    }

    public TileLayer (Path path, String fileNameField, String regionsField, String targetCrs) {
        this.path = path;
        this.fileNameField = fileNameField;
        this.regionsField = regionsField;
        this.layer = GeoJsonLayers.read(path);
        layer.requireField(fileNameField);
        GeometryReprojector reprojector = new GeometryReprojector(layer.crs, targetCrs);
        boolean hasObjectIds = layer.hasField(OBJECT_ID_FIELD);
        List<Feature> features = layer.features();
        for (int i = 0; i < features.size(); i++) {
            Feature feature = features.get(i);
            Number objectId = hasObjectIds ? feature.getNumber(OBJECT_ID_FIELD) : null;
            tiles.add(new Tile(
                  objectId != null ? objectId.intValue() : i + 1,
                  feature.getString(fileNameField),
                  reprojector.reproject(feature.geometry),
                  RegionSet.parse(hasMembership() ? feature.getString(regionsField) : null)
            ));
        }
        LOG.info("Loaded {} tiles from {}", tiles.size(), path);
    }

    public List<Tile> tiles () {
        return Collections.unmodifiableList(tiles);
    }

    public boolean hasMembership () {
        return layer.hasField(regionsField);
    }

    /// @throws SchemaException if the membership field has not been created yet.
    public void requireMembership () {
        if (!hasMembership()) throw new SchemaException(layer.name, regionsField);
    }

    /// Reset the membership field of every tile to the empty set, creating the field if needed.
    void clearMembership () {
        layer.addField(regionsField);
        for (int i = 0; i < tiles.size(); i++) {
            setMembership(i, RegionSet.empty());
        }
    }

    void setMembership (int index, RegionSet regions) {
        Tile tile = tiles.get(index);
        layer.features().get(index).set(regionsField, regions.format());
        tiles.set(index, new Tile(tile.objectId(), tile.fileName(), tile.footprint(), regions));
    }

    void save () {
        GeoJsonLayers.write(layer, path);
    }

}
