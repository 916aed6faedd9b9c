// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

/// Cell values of classification rasters. Every raster the pipeline writes from the final tile stage
/// onward uses the canonical codes. The classification tool delivers rasters in its own
/// transitional codes, which are converted once on the way in.
public abstract class ClassCodes {

    public static final int NON_CANOPY = 0;
    public static final int CANOPY = 1;

    /// Written where no tile or region claims a cell. Fits in the two bits classified rasters need.
    public static final int NO_DATA = 3;

    public static final int TRANSITIONAL_NON_CANOPY = 1;
    public static final int TRANSITIONAL_CANOPY = 2;

    public static boolean isClass (int value) {
        return value == NON_CANOPY || value == CANOPY;
    }

    /// Map transitional codes to canonical codes. Anything else the tool may have written becomes
    /// no-data.
    public static int fromTransitional (int value) {
        if (value == TRANSITIONAL_NON_CANOPY) return NON_CANOPY;
        if (value == TRANSITIONAL_CANOPY) return CANOPY;
        return NO_DATA;
    }

    /// Swap canopy and non-canopy, leaving any other value alone. Applying this twice yields the
    /// original value.
    public static int invert (int value) {
        if (value == CANOPY) return NON_CANOPY;
        if (value == NON_CANOPY) return CANOPY;
        return value;
    }

    public static GridRaster fromTransitional (GridRaster transitional) {
        GridRaster result = GridRaster.create(transitional.grid, 1, NO_DATA);
        short[] in = transitional.band(0);
        short[] out = result.band(0);
        for (int i = 0; i < in.length; i++) {
            out[i] = (short) fromTransitional(in[i]);
        }
        return result;
    }

    /// Return a copy of the first band with canopy and non-canopy swapped. The no-data value and
    /// every cell holding it are preserved.
    public static GridRaster invert (GridRaster raster) {
        GridRaster result = GridRaster.create(raster.grid, 1, raster.noData);
        short[] in = raster.band(0);
        short[] out = result.band(0);
        for (int i = 0; i < in.length; i++) {
            out[i] = raster.isNoData(in[i]) ? in[i] : (short) invert(in[i]);
        }
        return result;
    }

}
