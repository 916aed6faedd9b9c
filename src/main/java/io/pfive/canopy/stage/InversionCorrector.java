// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.raster.ClassCodes;
import io.pfive.canopy.raster.RasterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.List;

/// Fixes regions where classification came out with canopy and non-canopy swapped, by writing a
/// corrected canopy raster with the two classes exchanged. The original canopy raster is left in
/// place and a corrected raster is never overwritten, so correcting a region twice cannot flip it
/// back.
public class InversionCorrector {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final StagingLayout layout;
    private final RegionLayer regionLayer;
    private final RasterStore store;
    private final ProgressListener progress;

    public InversionCorrector (StagingLayout layout, RegionLayer regionLayer, RasterStore store,
                               ProgressListener progress) {
        this.layout = layout;
        this.regionLayer = regionLayer;
        this.store = store;
        this.progress = progress;
    }

    public StageReport correct (RegionSet regionIds) {
        StageReport report = new StageReport("correct-inverted");
        List<Region> regions = regionLayer.select(regionIds);
        progress.beginTask("Correcting inverted regions", regions.size());
        for (Region region : regions) {
            correctRegion(region, report);
            progress.increment();
        }
        report.logSummary();
        return report;
    }

    private void correctRegion (Region region, StageReport report) {
        if (!layout.hasOutputs(region)) {
            report.missing(region.toString(), "nothing in " + layout.outputsDir(region));
            return;
        }
        Path canopy = layout.canopy(region);
        Path corrected = layout.correctedCanopy(region);
        if (store.exists(corrected)) {
            LOG.debug("Already corrected: {}", corrected);
            layout.ledger(region).recordRegion(StageStatus.CORRECTED);
            report.alreadyDone();
            return;
        }
        if (!store.exists(canopy)) {
            report.missing(region.toString(), "no canopy raster at " + canopy);
            return;
        }
        store.write(ClassCodes.invert(store.read(canopy)), corrected, canopy.getFileName().toString());
        layout.ledger(region).recordRegion(StageStatus.CORRECTED);
        report.written();
    }

}
