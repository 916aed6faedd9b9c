// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.RegionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.List;

/// Runs the post-classification stages in order for a set of regions: convert, then clip, then
/// mosaic. Each stage skips whatever is already done, so running this again after an interruption
/// picks up where it stopped.
public class PipelineOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ClassificationNormalizer classificationNormalizer;
    private final FootprintClipper footprintClipper;
    private final RegionMosaicker regionMosaicker;

    public PipelineOrchestrator (ClassificationNormalizer classificationNormalizer,
                                 FootprintClipper footprintClipper, RegionMosaicker regionMosaicker) {
        this.classificationNormalizer = classificationNormalizer;
        this.footprintClipper = footprintClipper;
        this.regionMosaicker = regionMosaicker;
    }

    public List<StageReport> run (RegionSet regionIds) {
        LOG.info("Running convert, clip and mosaic for regions {}", regionIds);
        StageReport converted = classificationNormalizer.convert(regionIds);
        StageReport clipped = footprintClipper.clip(regionIds);
        StageReport mosaicked = regionMosaicker.mosaic(regionIds);
        return List.of(converted, clipped, mosaicked);
    }

}
