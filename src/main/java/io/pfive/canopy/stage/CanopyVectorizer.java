// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.Polygonizer;
import io.pfive.canopy.raster.RasterStore;
import io.pfive.canopy.vector.Feature;
import io.pfive.canopy.vector.FeatureLayer;
import io.pfive.canopy.vector.GeoJsonLayers;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/// Converts each region's final canopy raster into a polygon layer, one feature per connected
/// polygon with the class in a Canopy field.
public class CanopyVectorizer {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String CANOPY_FIELD = "Canopy";

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final RasterStore store;
    private final ProgressListener progress;

    public CanopyVectorizer (StagingLayout layout, RegionLayer regionLayer, RasterStore store,
                             ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.store = store;
        this.progress = progress;
    }

    public StageReport vectorize (RegionSet regionIds) {
        StageReport report = new StageReport("vectorize");
        List<Region> regions = regionLayer.select(regionIds);
        progress.beginTask("Vectorizing canopy rasters", regions.size());
        for (Region region : regions) {
            vectorizeRegion(region, report);
            progress.increment();
        }
        report.logSummary();
        return report;
    }

    private void vectorizeRegion (Region region, StageReport report) {
        Path output = layout.canopyPolygons(region);
        if (Files.exists(output)) {
            LOG.debug("Already vectorized: {}", output);
            report.alreadyDone();
            return;
        }
        Path raster = layout.finalCanopy(region);
        if (!store.exists(raster)) {
            report.missing(region.toString(), "no canopy raster at " + raster);
            return;
        }
        GeoJsonLayers.write(toPolygons(store.read(raster), output), output);
        report.written();
    }

    static FeatureLayer toPolygons (GridRaster canopy, Path output) {
        String name = StageNaming.baseName(output.getFileName().toString());
        FeatureLayer layer = new FeatureLayer(name, canopy.grid.crs(), List.of(CANOPY_FIELD));
        for (Map.Entry<Integer, Geometry> entry : new Polygonizer().polygonize(canopy).entrySet()) {
            Geometry area = entry.getValue();
            for (int i = 0; i < area.getNumGeometries(); i++) {
                Feature feature = new Feature(area.getGeometryN(i));
                feature.set(CANOPY_FIELD, entry.getKey());
                layer.add(feature);
            }
        }
        return layer;
    }

}
