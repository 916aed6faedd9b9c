// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.membership.TileSelector;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.GridSpec;
import io.pfive.canopy.raster.RasterException;
import io.pfive.canopy.raster.RasterStore;
import io.pfive.canopy.raster.Resampler;
import io.pfive.canopy.store.FileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Reprojects the imagery of every tile in the requested regions onto the reference grid, into each
/// region's Inputs folder, ready for classification. A tile in several regions is staged once per
/// region. Tiles already reprojected are skipped, and so are tiles whose imagery is missing or
/// unreadable, which are reported without stopping the run.
public class GridNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final TileSelector tileSelector;
    private final RasterStore store;
    private final ReferenceGrid referenceGrid;
    private final boolean trustExistingOutputs;
    private final ProgressListener progress;

    public GridNormalizer (StagingLayout layout, RegionLayer regionLayer, TileSelector tileSelector,
                           RasterStore store, ReferenceGrid referenceGrid, boolean trustExistingOutputs,
                           ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.tileSelector = tileSelector;
        this.store = store;
        this.referenceGrid = referenceGrid;
        this.trustExistingOutputs = trustExistingOutputs;
        this.progress = progress;
    }

    public StageReport reproject (RegionSet regionIds) {
        StageReport report = new StageReport("reproject");
        List<Tile> allTiles = tileSelector.select(regionIds);
        for (Region region : regionLayer.select(regionIds)) {
            FileStore.createDirectories(layout.inputsDir(region));
            FileStore.createDirectories(layout.outputsDir(region));
            StageLedger ledger = layout.ledger(region);
            List<Tile> tiles = tileSelector.tilesForRegion(region.id());
            progress.beginTask("Reprojecting tiles of " + region, tiles.size());
            for (Tile tile : tiles) {
                reprojectTile(region, tile, ledger, allTiles, report);
                progress.increment();
            }
            ledger.recordRegion(StageStatus.REPROJECTED);
        }
        report.logSummary();
        return report;
    }

    private void reprojectTile (Region region, Tile tile, StageLedger ledger, List<Tile> allTiles, StageReport report) {
        if (!tile.hasNaipName()) {
            report.missing(tile.fileName(), "not a NAIP quarter quadrangle file name");
            return;
        }
        String item = tile.sourceFileName();
        Path output = layout.reprojectedTile(region, tile);
        if (ledger.isDone(item, StageStatus.REPROJECTED, store.exists(output), trustExistingOutputs)) {
            LOG.debug("Already reprojected: {}", output);
            report.alreadyDone();
            return;
        }
        Path source = layout.sourceImagery(tile);
        if (!Files.exists(source)) {
            report.missing(item, "imagery not found at " + source);
            return;
        }
        GridRaster imagery;
        try {
            imagery = store.read(source);
        } catch (RasterException e) {
            report.missing(item, "imagery unreadable: " + e.getMessage());
            return;
        }
        // Resolved only once some tile actually needs reprojecting.
        GridSpec reference = referenceGrid.resolve(allTiles);
        store.write(Resampler.resample(imagery, reference), output, source.getFileName().toString());
        ledger.record(item, StageStatus.REPROJECTED);
        report.written();
    }

}
