// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.membership.TileSelector;
import io.pfive.canopy.raster.CellMask;
import io.pfive.canopy.raster.ClassCodes;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.RasterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.List;

/// Clips each final tile raster to its own tile footprint. Reprojected tiles overlap their
/// neighbors, and this is what removes the overlap: footprints of the tile index tile the area
/// without gaps, and CellMask gives each cell to exactly one of them, so no two clipped tiles of a
/// region hold data for the same cell. Output is cropped to the footprint, with cells outside it
/// set to no-data.
///
/// Tiles without a final raster are skipped quietly, which allows trying the pipeline on a few
/// tiles of a region.
public class FootprintClipper {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final TileSelector tileSelector;
    private final RasterStore store;
    private final boolean trustExistingOutputs;
    private final ProgressListener progress;

    public FootprintClipper (StagingLayout layout, RegionLayer regionLayer, TileSelector tileSelector,
                             RasterStore store, boolean trustExistingOutputs, ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.tileSelector = tileSelector;
        this.store = store;
        this.trustExistingOutputs = trustExistingOutputs;
        this.progress = progress;
    }

    public StageReport clip (RegionSet regionIds) {
        StageReport report = new StageReport("clip");
        for (Region region : regionLayer.select(regionIds)) {
            if (!layout.hasOutputs(region)) {
                report.missing(region.toString(), "nothing in " + layout.outputsDir(region));
                continue;
            }
            StageLedger ledger = layout.ledger(region);
            List<Tile> tiles = tileSelector.tilesForRegion(region.id());
            progress.beginTask("Clipping tiles of " + region, tiles.size());
            for (Tile tile : tiles) {
                clipTile(region, tile, ledger, report);
                progress.increment();
            }
            ledger.recordRegion(StageStatus.CLIPPED);
        }
        report.logSummary();
        return report;
    }

    private void clipTile (Region region, Tile tile, StageLedger ledger, StageReport report) {
        if (!tile.hasNaipName()) {
            report.missing(tile.fileName(), "not a NAIP quarter quadrangle file name");
            return;
        }
        String item = tile.sourceFileName();
        Path output = layout.clippedTile(region, tile);
        if (ledger.isDone(item, StageStatus.CLIPPED, store.exists(output), trustExistingOutputs)) {
            LOG.debug("Already clipped: {}", output);
            report.alreadyDone();
            return;
        }
        Path input = layout.finalTile(region, tile);
        if (!store.exists(input)) {
            LOG.debug("No final raster for {}, not clipping it.", tile);
            return;
        }
        GridRaster finalTile = store.read(input);
        GridRaster clipped = CellMask.forGrid(tile.footprint(), finalTile.grid).apply(finalTile, ClassCodes.NO_DATA);
        if (clipped == null) {
            report.missing(item, "footprint does not overlap raster " + input);
            return;
        }
        store.write(clipped, output, input.getFileName().toString());
        ledger.record(item, StageStatus.CLIPPED);
        report.written();
    }

}
