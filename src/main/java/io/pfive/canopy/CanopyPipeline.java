// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy;

import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.background.ProgressSink;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionMembershipIndex;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.membership.TileLayer;
import io.pfive.canopy.membership.TileSelector;
import io.pfive.canopy.raster.GeoTiffStore;
import io.pfive.canopy.raster.RasterStore;
import io.pfive.canopy.sampling.GroundTruthSampler;
import io.pfive.canopy.stage.CanopyVectorizer;
import io.pfive.canopy.stage.ClassificationNormalizer;
import io.pfive.canopy.stage.ClassificationSource;
import io.pfive.canopy.stage.FootprintClipper;
import io.pfive.canopy.stage.GridNormalizer;
import io.pfive.canopy.stage.InversionCorrector;
import io.pfive.canopy.stage.PipelineOrchestrator;
import io.pfive.canopy.stage.ReferenceGrid;
import io.pfive.canopy.stage.RegionMosaicker;
import io.pfive.canopy.stage.StagedClassificationSource;
import io.pfive.canopy.stage.StagingLayout;

import java.nio.file.Path;
import java.util.List;

/// Wires the stages together from one Configuration. Everything is built once here and nothing
/// reads configuration afterward, so picking up an edited configuration file means building a new
/// instance with reload() and dropping this one.
///
/// The layers are read when this is constructed. Region membership is written back to the tile
/// layer by assignRegions(), so stages that need membership should run on an instance built after
/// that.
public class CanopyPipeline {

    public final Configuration config;
    public final StagingLayout layout;

    private final RegionLayer regionLayer;
    private final TileLayer tileLayer;
    private final TileSelector tileSelector;
    private final RasterStore store;
    private final ProgressListener progress;

    public CanopyPipeline (Configuration config) {
        this(config, new GeoTiffStore(config.targetCrs), new ProgressSink());
    }

    public CanopyPipeline (Configuration config, RasterStore store, ProgressListener progress) {
        this.config = config;
        this.layout = new StagingLayout(config);
        this.regionLayer = new RegionLayer(config);
        this.tileLayer = new TileLayer(config);
        this.tileSelector = new TileSelector(tileLayer);
        this.store = store;
        this.progress = progress;
    }

    /// A new pipeline built from the configuration file re-read from disk.
    public CanopyPipeline reload () {
        return new CanopyPipeline(config.reload(), store, progress);
    }

    public int assignRegions () {
        return new RegionMembershipIndex(regionLayer, tileLayer, progress).assign();
    }

    public List<Tile> selectTiles (RegionSet regionIds) {
        return tileSelector.select(regionIds);
    }

    public StageReport reproject (RegionSet regionIds) {
        ReferenceGrid referenceGrid = new ReferenceGrid(config.snapRaster, config.targetCrs, layout, store);
        return new GridNormalizer(layout, regionLayer, tileSelector, store, referenceGrid,
              config.trustExistingOutputs, progress).reproject(regionIds);
    }

    public StageReport convert (RegionSet regionIds) {
        return classificationNormalizer().convert(regionIds);
    }

    public StageReport clip (RegionSet regionIds) {
        return footprintClipper().clip(regionIds);
    }

    public StageReport mosaic (RegionSet regionIds) {
        return regionMosaicker().mosaic(regionIds);
    }

    public List<StageReport> pipeline (RegionSet regionIds) {
        return new PipelineOrchestrator(classificationNormalizer(), footprintClipper(), regionMosaicker())
              .run(regionIds);
    }

    public StageReport correctInverted (RegionSet regionIds) {
        return new InversionCorrector(layout, regionLayer, store, progress).correct(regionIds);
    }

    public StageReport vectorize (RegionSet regionIds) {
        return new CanopyVectorizer(layout, regionLayer, store, progress).vectorize(regionIds);
    }

    public StageReport generatePoints (RegionSet regionIds, double minArea, double maxArea, int minPoints, int maxPoints) {
        return sampler().generate(regionIds, minArea, maxArea, minPoints, maxPoints);
    }

    public StageReport updatePoints (Path oldResultsRoot, int oldYear, RegionSet regionIds, RegionSet invertedIds) {
        return sampler().update(oldResultsRoot, oldYear, regionIds, invertedIds);
    }

    public List<Tile> tilesForPoints (Path pointsPath) {
        return sampler().tilesForPoints(pointsPath);
    }

    private ClassificationNormalizer classificationNormalizer () {
        ClassificationSource source = new StagedClassificationSource(layout);
        return new ClassificationNormalizer(layout, regionLayer, tileSelector, store, source,
              config.trustExistingOutputs, progress);
    }

    private FootprintClipper footprintClipper () {
        return new FootprintClipper(layout, regionLayer, tileSelector, store, config.trustExistingOutputs, progress);
    }

    private RegionMosaicker regionMosaicker () {
        return new RegionMosaicker(layout, regionLayer, tileSelector, store, config.trustExistingOutputs,
              config.mosaicPartialRegions, config.writeQuicklook, progress);
    }

    private GroundTruthSampler sampler () {
        return new GroundTruthSampler(layout, regionLayer, tileSelector, store, config.targetCrs,
              config.randomSeed, progress);
    }

}
