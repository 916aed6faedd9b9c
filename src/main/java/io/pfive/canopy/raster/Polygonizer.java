// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Converts the first band of a raster to polygons, one (multi)polygon per distinct cell value,
/// with edges following cell boundaries exactly. No-data cells are left out.
///
/// Each row is first reduced to runs of equal adjacent values, each run becoming one rectangle, and
/// the rectangles of each value are then dissolved with a cascaded union. This is much faster than
/// unioning single cells.
public class Polygonizer {

    private final GeometryFactory geometryFactory;

    public Polygonizer (GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    public Polygonizer () {
        this(new GeometryFactory());
    }

    /// @return a map from cell value to the area covered by that value, ordered by value.
    public Map<Integer, Geometry> polygonize (GridRaster raster) {
        GridSpec grid = raster.grid;
        Map<Integer, List<Geometry>> runsByValue = new TreeMap<>();
        for (int row = 0; row < grid.nRows(); row++) {
            int runStart = 0;
            for (int col = 1; col <= grid.nCols(); col++) {
                boolean runEnds = col == grid.nCols() || raster.get(row, col) != raster.get(row, runStart);
                if (!runEnds) continue;
                int value = raster.get(row, runStart);
                if (!raster.isNoData(value)) {
                    runsByValue.computeIfAbsent(value, v -> new ArrayList<>()).add(rectangle(grid, row, runStart, col));
                }
                runStart = col;
            }
        }
        Map<Integer, Geometry> result = new TreeMap<>();
        runsByValue.forEach((value, runs) -> result.put(value, UnaryUnionOp.union(runs)));
        return result;
    }

    /// Rectangle covering columns [colStart, colEnd) of one row.
    private Polygon rectangle (GridSpec grid, int row, int colStart, int colEnd) {
        double xMin = grid.xMin() + colStart * grid.cellWidth();
        double xMax = grid.xMin() + colEnd * grid.cellWidth();
        double yMax = grid.yMax() - row * grid.cellHeight();
        double yMin = grid.yMax() - (row + 1) * grid.cellHeight();
        return (Polygon) geometryFactory.toGeometry(new Envelope(xMin, xMax, yMin, yMax));
    }

}
