// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// In-memory rasters on aligned grids and the handful of raster operations the pipeline needs:
/// resampling onto a reference grid, masking by polygons, burning polygons in, compositing, and
/// tracing cells back out to polygons. Files are read and written through RasterStore.
package io.pfive.canopy.raster;
