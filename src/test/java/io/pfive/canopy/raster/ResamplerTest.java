// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResamplerTest {

    @Test
    void sameSystemResamplingSnapsToTheReference () {
        GridSpec reference = new GridSpec("EPSG:5070", 0, 100, 1, 1, 10, 10);
        GridRaster source = GridRaster.create(new GridSpec("EPSG:5070", 20.25, 50.25, 1, 1, 4, 4), 1, null);
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) source.set(row, col, 1 + row * 4 + col);
        }
        GridRaster result = Resampler.resample(source, reference);
        assertTrue(result.grid.alignedWith(reference));
        assertEquals(20, result.grid.xMin(), 1e-9);
        assertEquals(51, result.grid.yMax(), 1e-9);
        assertEquals(5, result.grid.nCols());
        assertEquals(5, result.grid.nRows());
        assertEquals(Integer.valueOf(Resampler.DEFAULT_NO_DATA), result.noData);
        // Centers in the first row and column fall outside the source.
        assertEquals(Resampler.DEFAULT_NO_DATA, result.get(0, 0));
        // The center (20.5, 49.5) is in source cell row 0, col 0.
        assertEquals(1, result.get(1, 0));
        assertEquals(16, result.get(4, 3));
    }

    @Test
    void utmImageryLandsOnTheAlbersGrid () {
        // Roughly a NAIP quarter quad in Arkansas, at coarse resolution.
        GridSpec utm = new GridSpec("EPSG:26915", 580_000, 4_000_000, 60, 60, 100, 120);
        GridRaster imagery = GridRaster.create(utm, 1, null);
        Arrays.fill(imagery.band(0), (short) 9);
        GridSpec reference = Resampler.projectedGrid(utm, "EPSG:5070");
        assertEquals("EPSG:5070", reference.crs());
        assertEquals(60, reference.cellWidth(), 1e-9);

        GridRaster result = Resampler.resample(imagery, reference);
        assertTrue(result.grid.alignedWith(reference));
        // The footprint is rotated in Albers, so some corners are fill but most cells are data.
        int data = result.count(9);
        assertTrue(data > utm.nCells() * 0.9, "data cells " + data);
        assertEquals(result.grid.nCells(), data + result.count(Resampler.DEFAULT_NO_DATA));
    }

}
