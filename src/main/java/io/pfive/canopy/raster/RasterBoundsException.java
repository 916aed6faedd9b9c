// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

/// A coordinate was resolved to a row or column outside the raster. Callers decide what this means
/// (a missing sample, usually) but positions are never clamped to the nearest edge cell.
public class RasterBoundsException extends RasterException {

    public final double x;
    public final double y;
    public final int row;
    public final int col;

    public RasterBoundsException (double x, double y, int row, int col, GridSpec grid) {
        super(String.format("Point (%f, %f) falls at row %d, column %d, outside raster of %d rows and %d columns.",
              x, y, row, col, grid.nRows(), grid.nCols()));
        this.x = x;
        this.y = y;
        this.row = row;
        this.col = col;
    }

}
