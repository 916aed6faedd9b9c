// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import com.google.common.base.Preconditions;

import java.util.List;

/// Composites aligned single band rasters into one raster covering the union of their extents.
/// Cells covered by no input hold no-data. Inputs are laid down in order and a cell already holding
/// data is never replaced, so when footprints have been clipped correctly the order does not matter.
/// Cells that more than one input tries to fill are counted, since that means the inputs overlap.
public abstract class Mosaic {

    public record Result (GridRaster raster, int overlappingCells) { }

    public static Result composite (List<GridRaster> inputs, int noData) {
        Preconditions.checkArgument(!inputs.isEmpty(), "At least one raster is needed to make a mosaic.");
        GridSpec union = inputs.get(0).grid;
        for (GridRaster input : inputs) {
            union = union.encompass(input.grid);
        }
        GridRaster mosaic = GridRaster.create(union, 1, noData);
        short[] out = mosaic.band(0);
        int overlapping = 0;
        for (GridRaster input : inputs) {
            GridSpec grid = input.grid;
            int rowOffset = grid.rowOffsetIn(union);
            int colOffset = grid.colOffsetIn(union);
            short[] in = input.band(0);
            for (int row = 0; row < grid.nRows(); row++) {
                for (int col = 0; col < grid.nCols(); col++) {
                    short value = in[grid.flatIndex(row, col)];
                    if (input.isNoData(value)) continue;
                    int i = union.flatIndex(row + rowOffset, col + colOffset);
                    if (out[i] == noData) {
                        out[i] = value;
                    } else {
                        overlapping += 1;
                    }
                }
            }
        }
        return new Result(mosaic, overlapping);
    }

}
