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
import io.pfive.canopy.raster.Mosaic;
import io.pfive.canopy.raster.QuicklookPngWriter;
import io.pfive.canopy.raster.RasterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Combines the clipped tiles of each region into a single mosaic, then masks that to the region
/// boundary to produce the region's canopy raster. A mosaic left by an earlier interrupted run is
/// reused rather than rebuilt. Regions missing some clipped tiles are only mosaicked when partial
/// mosaics are allowed, since otherwise a gap would silently become no-data in the canopy raster.
public class RegionMosaicker {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final TileSelector tileSelector;
    private final RasterStore store;
    private final boolean trustExistingOutputs;
    private final boolean mosaicPartialRegions;
    private final boolean writeQuicklook;
    private final ProgressListener progress;

    public RegionMosaicker (StagingLayout layout, RegionLayer regionLayer, TileSelector tileSelector,
                            RasterStore store, boolean trustExistingOutputs, boolean mosaicPartialRegions,
                            boolean writeQuicklook, ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.tileSelector = tileSelector;
        this.store = store;
        this.trustExistingOutputs = trustExistingOutputs;
        this.mosaicPartialRegions = mosaicPartialRegions;
        this.writeQuicklook = writeQuicklook;
        this.progress = progress;
    }

    public StageReport mosaic (RegionSet regionIds) {
        StageReport report = new StageReport("mosaic");
        List<Region> regions = regionLayer.select(regionIds);
        progress.beginTask("Mosaicking regions", regions.size());
        for (Region region : regions) {
            if (!layout.hasOutputs(region)) {
                report.missing(region.toString(), "nothing in " + layout.outputsDir(region));
            } else {
                mosaicRegion(region, report);
            }
            progress.increment();
        }
        report.logSummary();
        return report;
    }

    private void mosaicRegion (Region region, StageReport report) {
        StageLedger ledger = layout.ledger(region);
        Path canopy = layout.canopy(region);
        if (ledger.isRegionDone(StageStatus.MOSAICKED, store.exists(canopy), trustExistingOutputs)) {
            LOG.debug("Already mosaicked: {}", canopy);
            report.alreadyDone();
            return;
        }
        Path mosaicPath = layout.mosaic(region);
        String mosaicItem = mosaicPath.getFileName().toString();
        GridRaster mosaic;
        if (ledger.isDone(mosaicItem, StageStatus.MOSAICKED, store.exists(mosaicPath), trustExistingOutputs)) {
            LOG.info("Reusing mosaic {}", mosaicPath);
            mosaic = store.read(mosaicPath);
        } else {
            mosaic = buildMosaic(region, report);
            if (mosaic == null) return;
            store.write(mosaic, mosaicPath, "clipped tiles of " + region);
            ledger.record(mosaicItem, StageStatus.MOSAICKED);
        }
        GridRaster masked = new CellMask(region.boundary(), mosaic.grid.cellWidth(), mosaic.grid.cellHeight())
              .apply(mosaic, ClassCodes.NO_DATA);
        if (masked == null) {
            report.missing(region.toString(), "region boundary does not overlap mosaic " + mosaicPath);
            return;
        }
        store.write(masked, canopy, mosaicItem);
        ledger.recordRegion(StageStatus.MOSAICKED);
        report.written();
        if (writeQuicklook) QuicklookPngWriter.write(masked, layout.quicklook(region));
    }

    /// Read the region's clipped tiles and composite them, or return null after reporting why not.
    private GridRaster buildMosaic (Region region, StageReport report) {
        List<Tile> tiles = tileSelector.tilesForRegion(region.id());
        List<GridRaster> clipped = new ArrayList<>();
        List<String> absent = new ArrayList<>();
        for (Tile tile : tiles) {
            if (!tile.hasNaipName()) {
                absent.add(tile.fileName());
                continue;
            }
            Path path = layout.clippedTile(region, tile);
            if (store.exists(path)) clipped.add(store.read(path));
            else absent.add(tile.sourceFileName());
        }
        if (clipped.isEmpty()) {
            report.missing(region.toString(), "no clipped tiles to mosaic");
            return null;
        }
        if (!absent.isEmpty()) {
            if (!mosaicPartialRegions) {
                report.missing(region.toString(), absent.size() + " of " + tiles.size()
                      + " clipped tiles missing, including " + absent.get(0));
                return null;
            }
            LOG.warn("Mosaicking {} without {} of its {} tiles.", region, absent.size(), tiles.size());
        }
        Mosaic.Result result = Mosaic.composite(clipped, ClassCodes.NO_DATA);
        if (result.overlappingCells() > 0) {
            LOG.warn("{} cells of {} hold data from more than one clipped tile, keeping the first.",
                  result.overlappingCells(), region);
        }
        return result.raster();
    }

}
