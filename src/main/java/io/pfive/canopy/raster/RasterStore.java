// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import java.nio.file.Path;

/// Reading and writing georeferenced raster files. Stages only go through this interface, so
/// tests can count or intercept writes.
public interface RasterStore {

    GridRaster read (Path path);

    /// Read only the georeferencing of a raster, without its samples.
    GridSpec readGrid (Path path);

    /// Write the raster so that it appears under its final name only once complete.
    void write (GridRaster raster, Path path, String source);

    boolean exists (Path path);

}
