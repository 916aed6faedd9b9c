// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

/// Signals a raster that cannot be read, written, or combined with another: unreadable files,
/// missing georeferencing, grids that do not share an alignment. These abort the running stage.
public class RasterException extends RuntimeException {

    public RasterException (String message) {
        super(message);
    }

    public RasterException (String message, Throwable cause) {
        super(message, cause);
    }

}
