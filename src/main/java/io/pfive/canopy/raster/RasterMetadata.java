// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import java.time.Instant;

/// Georeferencing and provenance of one raster file, stored as a JSON sidecar next to it. The TIFF
/// itself holds only samples. This keeps everything the pipeline needs to place a raster in one
/// human-readable file.
public class RasterMetadata {

    public String crs;
    public double xMin;
    public double yMax;
    public double cellWidth;
    public double cellHeight;
    public int nCols;
    public int nRows;
    public int nBands;

    /// Null if every cell holds data.
    public Integer noData;

    /// Optional name of the file this raster was derived from.
    public String source;
    public String created;

    /// No-arg constructor to allow Jackson deserialization.
    private RasterMetadata () { }

    public static RasterMetadata forRaster (GridRaster raster, String source) {
        RasterMetadata metadata = new RasterMetadata();
        GridSpec grid = raster.grid;
        metadata.crs = grid.crs();
        metadata.xMin = grid.xMin();
        metadata.yMax = grid.yMax();
        metadata.cellWidth = grid.cellWidth();
        metadata.cellHeight = grid.cellHeight();
        metadata.nCols = grid.nCols();
        metadata.nRows = grid.nRows();
        metadata.nBands = raster.nBands();
        metadata.noData = raster.noData;
        metadata.source = source;
        metadata.created = Instant.now().toString();
        return metadata;
    }

    public GridSpec gridSpec () {
        return new GridSpec(crs, xMin, yMax, cellWidth, cellHeight, nCols, nRows);
    }

}
