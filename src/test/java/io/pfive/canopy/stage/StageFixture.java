// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.CountingRasterStore;
import io.pfive.canopy.TestData;
import io.pfive.canopy.background.ProgressListener;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.RegionLayer;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.membership.TileSelector;
import io.pfive.canopy.raster.ClassCodes;

import java.nio.file.Path;

/// The standard test data with every stage wired to one counting store.
class StageFixture {

    final TestData data;
    final StagingLayout layout;
    final RegionLayer regionLayer;
    final TileSelector selector;
    final CountingRasterStore store = new CountingRasterStore();

    StageFixture (Path dir) {
        this(dir, false);
    }

    /// With the foreign tile added to region 1 when asked for.
    StageFixture (Path dir, boolean withForeignTile) {
        data = TestData.standard(dir);
        if (withForeignTile) data.writeTilesWithForeignName();
        layout = data.layout();
        regionLayer = data.regionLayer();
        selector = data.tileSelector();
    }

    Region region (int id) {
        return regionLayer.region(id).orElseThrow();
    }

    Tile tile (String fileName) {
        return data.tile(fileName);
    }

    GridNormalizer gridNormalizer (boolean trustExistingOutputs) {
        ReferenceGrid referenceGrid = new ReferenceGrid(data.snapRaster, TestData.CRS, layout, store);
        return new GridNormalizer(layout, regionLayer, selector, store, referenceGrid, trustExistingOutputs,
              ProgressListener.NONE);
    }

    ClassificationNormalizer classificationNormalizer () {
        return classificationNormalizer(new StagedClassificationSource(layout));
    }

    ClassificationNormalizer classificationNormalizer (ClassificationSource source) {
        return new ClassificationNormalizer(layout, regionLayer, selector, store, source, true, ProgressListener.NONE);
    }

    FootprintClipper footprintClipper () {
        return new FootprintClipper(layout, regionLayer, selector, store, true, ProgressListener.NONE);
    }

    RegionMosaicker regionMosaicker (boolean mosaicPartialRegions, boolean writeQuicklook) {
        return new RegionMosaicker(layout, regionLayer, selector, store, true, mosaicPartialRegions, writeQuicklook,
              ProgressListener.NONE);
    }

    /// Reproject region 1 and leave raster classifications for its tiles: tile A all canopy and
    /// tile B all non-canopy, in the classification tool's codes.
    void classifyRegionOne () {
        gridNormalizer(true).reproject(RegionSet.of(1));
        data.writeRasterClassification(region(1), tile(TestData.TILE_A), ClassCodes.TRANSITIONAL_CANOPY);
        data.writeRasterClassification(region(1), tile(TestData.TILE_B), ClassCodes.TRANSITIONAL_NON_CANOPY);
    }

}
