// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import com.google.common.base.Preconditions;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygonal;

/// Decides which cells of a grid belong to a polygon: a cell belongs when its center is inside.
/// A center lying exactly on the polygon boundary is decided by testing a point displaced a tiny
/// fixed distance right and down instead. Two polygons that share an edge therefore never both
/// claim a cell centered on that edge, and polygons tiling an area without gaps claim every cell
/// exactly once.
public class CellMask {

    /// Displacement of boundary points as a fraction of the cell size. The x and y factors differ so
    /// the displaced point does not slide along a diagonal edge.
    private static final double NUDGE_X = 1e-4;
    private static final double NUDGE_Y = 1.3e-4;

    public final Geometry geometry;
    private final IndexedPointInAreaLocator locator;
    private final double nudgeX;
    private final double nudgeY;

    public CellMask (Geometry geometry, double cellWidth, double cellHeight) {
        Preconditions.checkArgument(geometry instanceof Polygonal, "Cells can only be masked by polygons.");
        this.geometry = geometry;
        this.locator = new IndexedPointInAreaLocator(geometry);
        this.nudgeX = cellWidth * NUDGE_X;
        this.nudgeY = cellHeight * NUDGE_Y;
    }

    public static CellMask forGrid (Geometry geometry, GridSpec grid) {
        return new CellMask(geometry, grid.cellWidth(), grid.cellHeight());
    }

    public boolean claims (double x, double y) {
        int location = locator.locate(new Coordinate(x, y));
        if (location == Location.INTERIOR) return true;
        if (location == Location.EXTERIOR) return false;
        return locator.locate(new Coordinate(x + nudgeX, y - nudgeY)) == Location.INTERIOR;
    }

    public boolean claimsCell (GridSpec grid, int row, int col) {
        return claims(grid.centerX(col), grid.centerY(row));
    }

    /// Return a copy of the raster cropped to the cells around the polygon, with every cell the
    /// polygon does not claim set to the no-data value. Returns null if the polygon does not
    /// overlap the raster at all.
    public GridRaster apply (GridRaster raster, int noData) {
        GridSpec grid = raster.grid;
        GridSpec cropped = grid.crop(geometry.getEnvelopeInternal());
        if (cropped == null) return null;
        int rowOffset = cropped.rowOffsetIn(grid);
        int colOffset = cropped.colOffsetIn(grid);
        GridRaster result = GridRaster.create(cropped, raster.nBands(), noData);
        for (int row = 0; row < cropped.nRows(); row++) {
            for (int col = 0; col < cropped.nCols(); col++) {
                if (!claimsCell(cropped, row, col)) continue;
                int sourceIndex = grid.flatIndex(row + rowOffset, col + colOffset);
                int targetIndex = cropped.flatIndex(row, col);
                for (int b = 0; b < raster.nBands(); b++) {
                    short value = raster.band(b)[sourceIndex];
                    // Cells that had no data keep the new no-data marker.
                    if (raster.isNoData(value)) continue;
                    result.band(b)[targetIndex] = value;
                }
            }
        }
        return result;
    }

}
