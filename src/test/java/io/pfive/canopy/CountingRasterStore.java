// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy;

import io.pfive.canopy.raster.GeoTiffStore;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.GridSpec;
import io.pfive.canopy.raster.RasterStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Passes everything through to a GeoTiffStore, remembering which files were written.
public class CountingRasterStore implements RasterStore {

    private final RasterStore delegate = new GeoTiffStore(TestData.CRS);
    public final List<Path> written = new ArrayList<>();

    @Override
    public GridRaster read (Path path) {
        return delegate.read(path);
    }

    @Override
    public GridSpec readGrid (Path path) {
        return delegate.readGrid(path);
    }

    @Override
    public void write (GridRaster raster, Path path, String source) {
        written.add(path);
        delegate.write(raster, path, source);
    }

    @Override
    public boolean exists (Path path) {
        return delegate.exists(path);
    }

}
