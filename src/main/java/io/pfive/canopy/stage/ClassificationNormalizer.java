// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

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
import io.pfive.canopy.raster.RasterStore;
import io.pfive.canopy.raster.Rasterizer;
import io.pfive.canopy.vector.Feature;
import io.pfive.canopy.vector.FeatureLayer;
import io.pfive.canopy.vector.GeoJsonLayers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// Turns each tile's classification artifact into a final tile raster with canonical class codes.
/// Polygons are burned onto the reprojected tile's grid, with cells outside every polygon set to
/// non-canopy. Rasters in the classification tool's transitional codes are recoded. Tiles with a
/// final raster already are skipped, and tiles not yet classified are reported and skipped.
public class ClassificationNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String CLASS_ID_FIELD = "CLASS_ID";

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final TileSelector tileSelector;
    private final RasterStore store;
    private final ClassificationSource classificationSource;
    private final boolean trustExistingOutputs;
    private final ProgressListener progress;

    public ClassificationNormalizer (StagingLayout layout, RegionLayer regionLayer, TileSelector tileSelector,
                                     RasterStore store, ClassificationSource classificationSource,
                                     boolean trustExistingOutputs, ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.tileSelector = tileSelector;
        this.store = store;
        this.classificationSource = classificationSource;
        this.trustExistingOutputs = trustExistingOutputs;
        this.progress = progress;
    }

    public StageReport convert (RegionSet regionIds) {
        StageReport report = new StageReport("convert");
        for (Region region : regionLayer.select(regionIds)) {
            if (!layout.hasOutputs(region)) {
                report.missing(region.toString(), "nothing in " + layout.outputsDir(region));
                continue;
            }
            StageLedger ledger = layout.ledger(region);
            List<Tile> tiles = tileSelector.tilesForRegion(region.id());
            progress.beginTask("Converting classifications of " + region, tiles.size());
            for (Tile tile : tiles) {
                convertTile(region, tile, ledger, report);
                progress.increment();
            }
            ledger.recordRegion(StageStatus.CLASSIFIED);
        }
        report.logSummary();
        return report;
    }

    private void convertTile (Region region, Tile tile, StageLedger ledger, StageReport report) {
        if (!tile.hasNaipName()) {
            report.missing(tile.fileName(), "not a NAIP quarter quadrangle file name");
            return;
        }
        String item = tile.sourceFileName();
        Path output = layout.finalTile(region, tile);
        if (ledger.isDone(item, StageStatus.CLASSIFIED, store.exists(output), trustExistingOutputs)) {
            LOG.debug("Already converted: {}", output);
            report.alreadyDone();
            return;
        }
        String reprojectedName = StageNaming.reprojected(item);
        Optional<ClassificationArtifact> artifact = classificationSource.find(region, reprojectedName);
        if (artifact.isEmpty()) {
            report.missing(item, "no classification of " + reprojectedName);
            return;
        }
        GridRaster canonical;
        if (artifact.get().kind() == ClassificationArtifact.Kind.POLYGONS) {
            Path reprojected = layout.reprojectedTile(region, tile);
            if (!store.exists(reprojected)) {
                report.missing(item, "polygons cannot be rasterized without reprojected tile " + reprojected);
                return;
            }
            canonical = rasterize(artifact.get().path(), store.readGrid(reprojected));
        } else {
            canonical = ClassCodes.fromTransitional(store.read(artifact.get().path()));
        }
        store.write(canonical, output, artifact.get().path().getFileName().toString());
        ledger.record(item, StageStatus.CLASSIFIED);
        report.written();
    }

    /// Burn classification polygons onto the grid. A polygon without a class is canopy, as the
    /// classification tool only outlines canopy when it writes no classes.
    static GridRaster rasterize (Path polygonPath, GridSpec grid) {
        FeatureLayer polygons = GeoJsonLayers.read(polygonPath);
        GeometryReprojector reprojector = new GeometryReprojector(polygons.crs, grid.crs());
        boolean hasClasses = polygons.hasField(CLASS_ID_FIELD);
        Rasterizer rasterizer = new Rasterizer(grid, ClassCodes.NON_CANOPY, ClassCodes.NO_DATA);
        for (Feature feature : polygons.features()) {
            if (feature.geometry == null) continue;
            Number classId = hasClasses ? feature.getNumber(CLASS_ID_FIELD) : null;
            int value = classId == null ? ClassCodes.CANOPY : classId.intValue();
            rasterizer.burn(reprojector.reproject(feature.geometry), value);
        }
        return rasterizer.result();
    }

}
