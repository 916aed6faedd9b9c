// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;

/// Burns polygons into a single band raster. A cell takes the value of a polygon that claims its
/// center, by the same rule CellMask uses. Where polygons overlap the one burned last wins. Cells
/// claimed by no polygon keep the background value.
///
/// Only cells within the bounding box of each polygon are evaluated, and the polygon is indexed
/// once before iterating over them, which keeps this fast even for the thousands of small polygons
/// a classified tile contains.
public class Rasterizer {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final GridRaster raster;
    private int nBurned = 0;
    private int nSkipped = 0;

    public Rasterizer (GridSpec grid, int background, Integer noData) {
        raster = GridRaster.create(grid, 1, noData);
        if (background != raster.fillValue()) {
            Arrays.fill(raster.band(0), (short) background);
        }
    }

    public void burn (Geometry geometry, int value) {
        if (!(geometry instanceof Polygonal) || geometry.isEmpty()) {
            nSkipped += 1;
            return;
        }
        GridSpec grid = raster.grid;
        // Find the range of grid cells whose centers could fall within this geometry.
        Envelope env = geometry.getEnvelopeInternal();
        int minCol = Math.max(grid.colForX(env.getMinX()), 0);
        int maxCol = Math.min(grid.colForX(env.getMaxX()), grid.nCols() - 1);
        int minRow = Math.max(grid.rowForY(env.getMaxY()), 0);
        int maxRow = Math.min(grid.rowForY(env.getMinY()), grid.nRows() - 1);
        if (minCol > maxCol || minRow > maxRow) {
            nSkipped += 1;
            return;
        }
        CellMask mask = CellMask.forGrid(geometry, grid);
        for (int row = minRow; row <= maxRow; row++) {
            for (int col = minCol; col <= maxCol; col++) {
                if (mask.claimsCell(grid, row, col)) raster.set(row, col, value);
            }
        }
        nBurned += 1;
    }

    public GridRaster result () {
        if (nSkipped > 0) {
            LOG.debug("Rasterized {} polygons, skipped {} empty, non-polygonal or outside the grid.", nBurned, nSkipped);
        }
        return raster;
    }

}
