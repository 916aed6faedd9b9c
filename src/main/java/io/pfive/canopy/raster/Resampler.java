// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import io.pfive.canopy.geo.GeometryReprojector;
import org.locationtech.jts.geom.Envelope;

/// Nearest neighbor resampling of a raster onto the alignment of another grid, reprojecting if the
/// two are in different coordinate systems. Each output cell takes the value of the source cell
/// containing the output cell's center, so class codes and 8-bit imagery values pass through
/// unchanged. Output cells whose center falls outside the source get the no-data value.
public abstract class Resampler {

    /// Imagery tiles carry no no-data value of their own. Zero is what the source imagery uses as
    /// fill around the edges of reprojected tiles.
    public static final int DEFAULT_NO_DATA = 0;

    /// Resample the source onto cells aligned with the reference grid, covering the whole footprint
    /// of the source after reprojection.
    public static GridRaster resample (GridRaster source, GridSpec reference) {
        GeometryReprojector forward = new GeometryReprojector(source.grid.crs(), reference.crs());
        Envelope targetEnvelope = forward.reproject(source.grid.envelope());
        GridSpec targetGrid = reference.snapOutward(targetEnvelope);
        return resampleOnto(source, targetGrid);
    }

    /// Resample the source onto exactly the given grid.
    public static GridRaster resampleOnto (GridRaster source, GridSpec targetGrid) {
        Integer noData = source.noData != null ? source.noData : DEFAULT_NO_DATA;
        GridRaster target = GridRaster.create(targetGrid, source.nBands(), noData);
        // Map each target cell center back into the source system.
        GeometryReprojector inverse = new GeometryReprojector(targetGrid.crs(), source.grid.crs());
        for (int row = 0; row < targetGrid.nRows(); row++) {
            for (int col = 0; col < targetGrid.nCols(); col++) {
                double[] xy = inverse.reproject(targetGrid.centerX(col), targetGrid.centerY(row));
                int sourceIndex = source.grid.flatIndexForXY(xy[0], xy[1]);
                if (sourceIndex < 0) continue;
                int targetIndex = targetGrid.flatIndex(row, col);
                for (int b = 0; b < source.nBands(); b++) {
                    target.band(b)[targetIndex] = source.band(b)[sourceIndex];
                }
            }
        }
        return target;
    }

    /// Define a grid in another coordinate system covering the source, with the same cell size as
    /// the source and its top left corner at the top left of the reprojected footprint. This is
    /// how a reference grid is derived from a single tile when none exists yet.
    public static GridSpec projectedGrid (GridSpec source, String targetCrs) {
        GeometryReprojector forward = new GeometryReprojector(source.crs(), targetCrs);
        Envelope env = forward.reproject(source.envelope());
        double cellWidth = source.cellWidth();
        double cellHeight = source.cellHeight();
        int nCols = Math.max(1, (int) Math.ceil(env.getWidth() / cellWidth));
        int nRows = Math.max(1, (int) Math.ceil(env.getHeight() / cellHeight));
        return new GridSpec(targetCrs, env.getMinX(), env.getMaxY(), cellWidth, cellHeight, nCols, nRows);
    }

}
