// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import com.google.common.base.Preconditions;
import io.pfive.canopy.Configuration;
import io.pfive.canopy.geo.GeometryReprojector;
import io.pfive.canopy.vector.Feature;
import io.pfive.canopy.vector.FeatureLayer;
import io.pfive.canopy.vector.GeoJsonLayers;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/// The physiographic region layer. Regions are loaded once, with boundaries transformed into the
/// analysis coordinate system. The only thing ever written back is the area field.
public class RegionLayer {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final double SQUARE_METERS_PER_SQUARE_KM = 1_000_000;

    public final Path path;
    public final String idField;
    public final String nameField;
    public final String areaField;
    private final FeatureLayer layer;
    private final List<Region> regions = new ArrayList<>();

    public RegionLayer (Configuration config) {
        this(config.regionLayer, config.regionIdField, config.regionNameField, config.regionAreaField, config.targetCrs);
    }

    public RegionLayer (Path path, String idField, String nameField, String areaField, String targetCrs) {
        this.path = path;
        this.idField = idField;
        this.nameField = nameField;
        this.areaField = areaField;
        this.layer = GeoJsonLayers.read(path);
        layer.requireField(idField);
        layer.requireField(nameField);
        GeometryReprojector reprojector = new GeometryReprojector(layer.crs, targetCrs);
        for (Feature feature : layer.features()) {
            Number id = feature.getNumber(idField);
            Preconditions.checkState(id != null, "Region without a value for %s in %s", idField, path);
            Geometry boundary = reprojector.reproject(feature.geometry);
            Number area = layer.hasField(areaField) ? feature.getNumber(areaField) : null;
            double areaSqKm = area != null ? area.doubleValue() : areaSqKm(boundary);
            regions.add(new Region(id.intValue(), feature.getString(nameField), boundary, areaSqKm));
        }
        LOG.info("Loaded {} regions from {}", regions.size(), path);
    }

    public static double areaSqKm (Geometry boundary) {
        return boundary.getArea() / SQUARE_METERS_PER_SQUARE_KM;
    }

    public List<Region> regions () {
        return Collections.unmodifiableList(regions);
    }

    public Optional<Region> region (int id) {
        return regions.stream().filter(r -> r.id() == id).findFirst();
    }

    /// The regions with the given ids, in layer order. Requested ids not found in the layer are
    /// reported and left out.
    public List<Region> select (RegionSet ids) {
        List<Region> selected = new ArrayList<>();
        RegionSet found = RegionSet.empty();
        for (Region region : regions) {
            if (ids.contains(region.id())) {
                selected.add(region);
                found.add(region.id());
            }
        }
        for (int id : ids.toArray()) {
            if (!found.contains(id)) LOG.warn("No region with id {} in {}", id, path);
        }
        return selected;
    }

    /// Replace the area field, deleting and recreating it, with the areas of the boundaries in the
    /// analysis coordinate system. Region records are updated to match.
    void recomputeAreas () {
        layer.deleteField(areaField);
        layer.addField(areaField);
        List<Feature> features = layer.features();
        for (int i = 0; i < regions.size(); i++) {
            Region region = regions.get(i);
            double areaSqKm = areaSqKm(region.boundary());
            features.get(i).set(areaField, areaSqKm);
            regions.set(i, new Region(region.id(), region.name(), region.boundary(), areaSqKm));
        }
    }

    void save () {
        GeoJsonLayers.write(layer, path);
    }

}
