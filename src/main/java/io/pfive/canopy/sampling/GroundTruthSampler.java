// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.sampling;

import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.geo.GeometryReprojector;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.membership.TileSelector;
import io.pfive.canopy.raster.ClassCodes;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.GridSpec;
import io.pfive.canopy.raster.RasterBoundsException;
import io.pfive.canopy.raster.RasterStore;
import io.pfive.canopy.raster.RowColumn;
import io.pfive.canopy.stage.StageNaming;
import io.pfive.canopy.stage.StagingLayout;
import io.pfive.canopy.store.FileStore;
import io.pfive.canopy.vector.Feature;
import io.pfive.canopy.vector.FeatureLayer;
import io.pfive.canopy.vector.GeoJsonLayers;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Random;

/// Creates and maintains the ground truth point sets used to assess classification accuracy. Each
/// region gets random points inside its boundary, each carrying the class found under it in one
/// GT_year field per analysis year. Points for a new year are the previous year's points with a
/// field added, so accuracy can be compared across years at the same locations.
///
/// Existing point sets are never overwritten.
public class GroundTruthSampler {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final TileSelector tileSelector;
    private final RasterStore store;
    private final String targetCrs;
    private final Random random;
    private final ProgressListener progress;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public GroundTruthSampler (StagingLayout layout, RegionLayer regionLayer, TileSelector tileSelector,
                               RasterStore store, String targetCrs, OptionalLong seed, ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.tileSelector = tileSelector;
        this.store = store;
        this.targetCrs = targetCrs;
        this.random = seed.isPresent() ? new Random(seed.getAsLong()) : new Random();
        this.progress = progress;
    }

    /// Generate a new point set for each region, with point counts following its area.
    public StageReport generate (RegionSet regionIds, double minArea, double maxArea, int minPoints, int maxPoints) {
        PointCountRule rule = new PointCountRule(minArea, maxArea, minPoints, maxPoints);
        LOG.info("Generating ground truth points, {}", rule);
        StageReport report = new StageReport("generate-points");
        String field = StageNaming.groundTruthField(layout.year);
        List<Region> regions = regionLayer.select(regionIds);
        progress.beginTask("Generating ground truth points", regions.size());
        for (Region region : regions) {
            Path output = layout.groundTruthPoints(region);
            if (Files.exists(output)) {
                LOG.info("{} already exists, not replacing it.", output);
                report.alreadyDone();
            } else {
                FeatureLayer points = new FeatureLayer(StageNaming.baseName(output.getFileName().toString()),
                      targetCrs, List.of(field));
                int n = rule.count(region.areaSqKm());
                Geometry randomPoints = randomPoints(region.boundary(), n);
                for (int i = 0; i < randomPoints.getNumGeometries(); i++) {
                    points.add(new Feature(randomPoints.getGeometryN(i)));
                }
                sampleInto(points, field, region, false);
                FileStore.createDirectories(output.getParent());
                GeoJsonLayers.write(points, output);
                LOG.info("Wrote {} points for {} of {} square km", n, region, String.format("%.1f", region.areaSqKm()));
                report.written();
            }
            progress.increment();
        }
        report.logSummary();
        return report;
    }

    /// Carry each region's point set from an earlier analysis forward to this year, adding this
    /// year's classes. Regions listed as inverted had canopy and non-canopy swapped by
    /// classification, so their values are flipped unless they come from a corrected raster.
    public StageReport update (Path oldResultsRoot, int oldYear, RegionSet regionIds, RegionSet invertedIds) {
        StageReport report = new StageReport("update-points");
        StagingLayout oldLayout = layout.forYear(oldResultsRoot, oldYear);
        String field = StageNaming.groundTruthField(layout.year);
        List<Region> regions = regionLayer.select(regionIds);
        progress.beginTask("Updating ground truth points", regions.size());
        for (Region region : regions) {
            updateRegion(oldLayout, region, field, invertedIds.contains(region.id()), report);
            progress.increment();
        }
        report.logSummary();
        return report;
    }

    private void updateRegion (StagingLayout oldLayout, Region region, String field, boolean inverted,
                               StageReport report) {
        Path oldPoints = oldLayout.groundTruthPoints(region);
        Path output = layout.groundTruthPoints(region);
        if (Files.exists(output)) {
            LOG.info("{} already exists, not replacing it.", output);
            report.alreadyDone();
            return;
        }
        if (!Files.exists(oldPoints)) {
            report.missing(region.toString(), "no earlier points at " + oldPoints);
            return;
        }
        FeatureLayer old = GeoJsonLayers.read(oldPoints);
        FeatureLayer points = new FeatureLayer(StageNaming.baseName(output.getFileName().toString()),
              old.crs, old.fields(), old.features());
        points.addField(field);
        sampleInto(points, field, region, inverted);
        FileStore.createDirectories(output.getParent());
        GeoJsonLayers.write(points, output);
        report.written();
    }

    /// Set the field of every point to the class under it in the region's final canopy raster, or
    /// null where there is no raster, the point is outside it, or the cell has no data.
    private void sampleInto (FeatureLayer points, String field, Region region, boolean inverted) {
        Path rasterPath = layout.finalCanopy(region);
        if (!store.exists(rasterPath)) {
            LOG.warn("No canopy raster for {}, {} will be empty.", region, field);
            return;
        }
        GridRaster raster = store.read(rasterPath);
        boolean flip = inverted && !rasterPath.equals(layout.correctedCanopy(region));
        if (flip) LOG.info("Flipping classes sampled from uncorrected raster {}", rasterPath);
        GeometryReprojector reprojector = new GeometryReprojector(points.crs, raster.grid.crs());
        int outside = 0;
        for (Feature feature : points.features()) {
            Integer value = sample(raster, reprojector.reproject(feature.geometry));
            if (value == null) outside++;
            else if (flip) value = ClassCodes.invert(value);
            feature.set(field, value);
        }
        if (outside > 0) LOG.warn("{} of {} points of {} have no class.", outside, points.size(), region);
    }

    @Nullable
    private static Integer sample (GridRaster raster, Geometry point) {
        try {
            RowColumn cell = rowColumn(point, raster.grid);
            int value = raster.get(cell.row(), cell.col());
            return raster.isNoData(value) ? null : value;
        } catch (RasterBoundsException e) {
            return null;
        }
    }

    /// The cell of the grid containing a point, which must be in the grid's coordinate system.
    /// @throws RasterBoundsException if the point is outside the grid.
    public static RowColumn rowColumn (Geometry point, GridSpec grid) {
        Coordinate c = point.getCoordinate();
        return grid.rowColumn(c.x, c.y);
    }

    /// The imagery tiles under a point set, for checking ground truth against the imagery.
    public List<Tile> tilesForPoints (Path pointsPath) {
        FeatureLayer points = GeoJsonLayers.read(pointsPath);
        GeometryReprojector reprojector = new GeometryReprojector(points.crs, targetCrs);
        List<Geometry> geometries = new ArrayList<>();
        for (Feature feature : points.features()) {
            if (feature.geometry != null) geometries.add(reprojector.reproject(feature.geometry));
        }
        List<Tile> tiles = tileSelector.tilesIntersecting(geometryFactory.buildGeometry(geometries));
        LOG.info("{} points of {} fall on {} tiles:", geometries.size(), pointsPath, tiles.size());
        for (Tile tile : tiles) {
            LOG.info("  {}", tile.hasNaipName() ? layout.sourceImagery(tile) : tile);
        }
        return tiles;
    }

    private Geometry randomPoints (Geometry boundary, int n) {
        SeededRandomPointsBuilder builder = new SeededRandomPointsBuilder(geometryFactory, random);
        builder.setExtent(boundary);
        builder.setNumPoints(n);
        return builder.getGeometry();
    }

}
