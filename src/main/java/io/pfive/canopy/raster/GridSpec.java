// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import com.google.common.base.Preconditions;
import io.pfive.canopy.geo.Crs;
import org.locationtech.jts.geom.Envelope;

/// The geometry of a raster: coordinate system, position of the top left corner, cell size, and
/// number of cells. Rows count downward from yMax as in image formats, so row 0 is the northern
/// edge. Cell sizes are positive in both dimensions.
///
/// Two grids are aligned when they share a coordinate system and cell size and their corners are
/// separated by a whole number of cells. Every raster derived from the reference grid is aligned
/// with it, so cells of different rasters coincide exactly and can be combined by index.
public record GridSpec (String crs, double xMin, double yMax, double cellWidth, double cellHeight,
                        int nCols, int nRows) {

    /// Fraction of a cell within which two positions are considered the same grid line. This
    /// absorbs rounding error accumulated when corners are computed as origin plus n cells.
    private static final double EPSILON = 1e-6;

    public GridSpec {
        Preconditions.checkArgument(cellWidth > 0 && cellHeight > 0, "Cell size must be positive.");
        Preconditions.checkArgument(nCols > 0 && nRows > 0, "Grid must contain at least one cell.");
        crs = Crs.normalize(crs);
        // Cells are addressed by a flat int index into one array per band.
        try {
            Math.multiplyExact(nCols, nRows);
        } catch (ArithmeticException e) {
            throw new RasterException(String.format("Grid of %d by %d cells in %s at (%f, %f) is too large for one raster.",
                  nCols, nRows, crs, xMin, yMax), e);
        }
    }

    public double xMax () { return xMin + nCols * cellWidth; }
    public double yMin () { return yMax - nRows * cellHeight; }
    public int nCells () { return nCols * nRows; }

    public double centerX (int col) {
        return xMin + (col + 0.5) * cellWidth;
    }

    public double centerY (int row) {
        return yMax - (row + 0.5) * cellHeight;
    }

    /// Does not perform range checks, for use in constrained iteration over provably safe ranges.
    public int flatIndex (int row, int col) {
        return row * nCols + col;
    }

    public int colForX (double x) {
        return (int) Math.floor((x - xMin) / cellWidth);
    }

    public int rowForY (double y) {
        return (int) Math.floor((yMax - y) / cellHeight);
    }

    public boolean contains (int row, int col) {
        return row >= 0 && row < nRows && col >= 0 && col < nCols;
    }

    /// Resolve a coordinate in this grid's coordinate system to the cell containing it. The left
    /// and top edges of a cell belong to it, the right and bottom edges to its neighbors.
    /// @throws RasterBoundsException if the cell is outside the grid.
    public RowColumn rowColumn (double x, double y) {
        int col = colForX(x);
        int row = rowForY(y);
        if (!contains(row, col)) throw new RasterBoundsException(x, y, row, col, this);
        return new RowColumn(row, col);
    }

    /// Like rowColumn, but returns -1 for points that are not binned into the cells of this grid.
    public int flatIndexForXY (double x, double y) {
        int col = colForX(x);
        int row = rowForY(y);
        if (!contains(row, col)) return -1;
        return flatIndex(row, col);
    }

    public Envelope envelope () {
        return new Envelope(xMin, xMax(), yMin(), yMax);
    }

    public boolean sameCrs (GridSpec other) {
        return crs.equals(other.crs);
    }

    public boolean alignedWith (GridSpec other) {
        if (!sameCrs(other)) return false;
        if (Math.abs(cellWidth - other.cellWidth) > EPSILON * cellWidth) return false;
        if (Math.abs(cellHeight - other.cellHeight) > EPSILON * cellHeight) return false;
        return isWhole((xMin - other.xMin) / cellWidth) && isWhole((yMax - other.yMax) / cellHeight);
    }

    private static boolean isWhole (double cells) {
        return Math.abs(cells - Math.rint(cells)) < EPSILON;
    }

    /// Return the smallest grid with this grid's alignment and cell size that contains the given
    /// envelope (in this grid's coordinate system). The result may extend beyond this grid.
    public GridSpec snapOutward (Envelope env) {
        Preconditions.checkArgument(!env.isNull(), "Cannot snap an empty envelope.");
        long colMin = (long) Math.floor((env.getMinX() - xMin) / cellWidth + EPSILON);
        long colMax = (long) Math.ceil((env.getMaxX() - xMin) / cellWidth - EPSILON);
        long rowMin = (long) Math.floor((yMax - env.getMaxY()) / cellHeight + EPSILON);
        long rowMax = (long) Math.ceil((yMax - env.getMinY()) / cellHeight - EPSILON);
        int nColsNew = (int) Math.max(colMax - colMin, 1);
        int nRowsNew = (int) Math.max(rowMax - rowMin, 1);
        return new GridSpec(crs, xMin + colMin * cellWidth, yMax - rowMin * cellHeight,
              cellWidth, cellHeight, nColsNew, nRowsNew);
    }

    /// Like snapOutward, but restricted to the cells of this grid. Returns null if the envelope
    /// does not overlap any cell of this grid.
    public GridSpec crop (Envelope env) {
        Envelope overlap = envelope().intersection(env);
        if (overlap.isNull() || overlap.getWidth() <= 0 || overlap.getHeight() <= 0) return null;
        return snapOutward(overlap);
    }

    /// Create a new grid that is a minimal bounding grid for this one and the supplied aligned one.
    public GridSpec encompass (GridSpec other) {
        checkAligned(other);
        Envelope env = envelope();
        env.expandToInclude(other.envelope());
        return snapOutward(env);
    }

    /// Column in the other grid of this grid's first column. Grids must be aligned.
    public int colOffsetIn (GridSpec outer) {
        return (int) Math.rint((xMin - outer.xMin) / cellWidth);
    }

    /// Row in the other grid of this grid's first row. Grids must be aligned.
    public int rowOffsetIn (GridSpec outer) {
        return (int) Math.rint((outer.yMax - yMax) / cellHeight);
    }

    public void checkAligned (GridSpec other) {
        if (!alignedWith(other)) {
            throw new RasterException("Grids are not aligned: " + this + " and " + other);
        }
    }

}
