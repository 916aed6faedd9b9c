// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.util.Arrays;

/// Raster data held in memory: one or more bands of 16-bit samples over a GridSpec. Imagery tiles
/// have three or four 8-bit bands and classification rasters a single band, so short is wide
/// enough for everything the pipeline handles. Each band is a flat array in row-major order
/// starting at the top left corner.
public class GridRaster {

    public final GridSpec grid;
    private final short[][] bands;

    /// Value marking cells with no data, or null if every cell holds data.
    @Nullable
    public final Integer noData;

    public GridRaster (GridSpec grid, short[][] bands, @Nullable Integer noData) {
        Preconditions.checkArgument(bands.length > 0, "Raster must have at least one band.");
        for (short[] band : bands) {
            Preconditions.checkArgument(band.length == grid.nCells(), "Band size does not match grid.");
        }
        this.grid = grid;
        this.bands = bands;
        this.noData = noData;
    }

    /// Create a raster with every cell of every band set to the no-data value (or zero if there
    /// is none).
    public static GridRaster create (GridSpec grid, int nBands, @Nullable Integer noData) {
        short[][] bands = new short[nBands][grid.nCells()];
        if (noData != null && noData != 0) {
            for (short[] band : bands) Arrays.fill(band, noData.shortValue());
        }
        return new GridRaster(grid, bands, noData);
    }

    public int nBands () {
        return bands.length;
    }

    public int get (int band, int row, int col) {
        return bands[band][grid.flatIndex(row, col)];
    }

    public void set (int band, int row, int col, int value) {
        bands[band][grid.flatIndex(row, col)] = (short) value;
    }

    public int get (int row, int col) {
        return get(0, row, col);
    }

    public void set (int row, int col, int value) {
        set(0, row, col, value);
    }

    /// Value of the first band at a coordinate in the raster's own coordinate system.
    /// @throws RasterBoundsException if the coordinate is outside the raster.
    public int valueAt (double x, double y) {
        RowColumn rc = grid.rowColumn(x, y);
        return get(rc.row(), rc.col());
    }

    public boolean isNoData (int value) {
        return noData != null && noData == value;
    }

    /// The value written into cells that have nothing in them, zero when no no-data value is set.
    public int fillValue () {
        return noData == null ? 0 : noData;
    }

    /// Number of cells in the first band holding the given value.
    public int count (int value) {
        int n = 0;
        for (short v : bands[0]) if (v == value) n += 1;
        return n;
    }

    public GridRaster copy () {
        short[][] copied = new short[bands.length][];
        for (int b = 0; b < bands.length; b++) copied[b] = bands[b].clone();
        return new GridRaster(grid, copied, noData);
    }

    /// The same samples under a different no-data value. Samples are shared, not copied.
    public GridRaster withNoData (@Nullable Integer newNoData) {
        return new GridRaster(grid, bands, newNoData);
    }

    /// Exposes the underlying band for bulk access by writers. Mutations are visible in the raster.
    public short[] band (int band) {
        return bands[band];
    }

    public boolean sameSamples (GridRaster other) {
        if (!grid.equals(other.grid) || bands.length != other.bands.length) return false;
        for (int b = 0; b < bands.length; b++) {
            if (!Arrays.equals(bands[b], other.bands[b])) return false;
        }
        return true;
    }

}
