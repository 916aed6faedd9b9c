// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridSpecTest {

    private static final GridSpec GRID = new GridSpec("epsg:5070", 0, 100, 1, 1, 100, 100);

    @Test
    void rowsCountDownFromTheTop () {
        RowColumn cell = GRID.rowColumn(10.5, 89.5);
        assertEquals(10, cell.row());
        assertEquals(10, cell.col());
        assertEquals(new RowColumn(0, 0), GRID.rowColumn(0, 100));
        assertEquals(new RowColumn(99, 99), GRID.rowColumn(99.999, 0.001));
    }

    @Test
    void pointsOutsideTheGridAreNeverClamped () {
        RasterBoundsException e = assertThrows(RasterBoundsException.class, () -> GRID.rowColumn(-0.5, 50));
        assertEquals(-1, e.col);
        assertThrows(RasterBoundsException.class, () -> GRID.rowColumn(50, 100.5));
        assertThrows(RasterBoundsException.class, () -> GRID.rowColumn(100, 50));
        assertThrows(RasterBoundsException.class, () -> GRID.rowColumn(50, 0));
        assertEquals(-1, GRID.flatIndexForXY(100, 50));
    }

    @Test
    void gridsTooLargeToIndexAreRejected () {
        RasterException e = assertThrows(RasterException.class,
              () -> new GridSpec("EPSG:5070", 0, 30_000, 0.6, 0.6, 50_000, 50_000));
        assertTrue(e.getMessage().contains("50000 by 50000"));
        assertTrue(e.getMessage().contains("EPSG:5070"));
        assertEquals(46_340 * 46_340, new GridSpec("EPSG:5070", 0, 30_000, 0.6, 0.6, 46_340, 46_340).nCells());
    }

    @Test
    void coordinateSystemNamesAreNormalized () {
        assertEquals("EPSG:5070", GRID.crs());
    }

    @Test
    void snapOutwardKeepsAlignment () {
        GridSpec snapped = GRID.snapOutward(new Envelope(10.2, 19.7, 30.1, 40.9));
        assertEquals(10, snapped.xMin(), 1e-9);
        assertEquals(41, snapped.yMax(), 1e-9);
        assertEquals(10, snapped.nCols());
        assertEquals(11, snapped.nRows());
        assertTrue(snapped.alignedWith(GRID));
        // An envelope already on cell edges is not grown.
        GridSpec exact = GRID.snapOutward(new Envelope(10, 20, 30, 40));
        assertEquals(10, exact.nCols());
        assertEquals(10, exact.nRows());
    }

    @Test
    void cropIsLimitedToTheGrid () {
        GridSpec cropped = GRID.crop(new Envelope(90, 120, -5, 5));
        assertEquals(90, cropped.xMin(), 1e-9);
        assertEquals(10, cropped.nCols());
        assertEquals(5, cropped.nRows());
        assertNull(GRID.crop(new Envelope(200, 300, 0, 10)));
    }

    @Test
    void encompassAndOffsets () {
        GridSpec a = new GridSpec("EPSG:5070", 0, 10, 1, 1, 10, 10);
        GridSpec b = new GridSpec("EPSG:5070", 10, 5, 1, 1, 10, 10);
        GridSpec union = a.encompass(b);
        assertEquals(0, union.xMin(), 1e-9);
        assertEquals(10, union.yMax(), 1e-9);
        assertEquals(20, union.nCols());
        assertEquals(15, union.nRows());
        assertEquals(10, b.colOffsetIn(union));
        assertEquals(5, b.rowOffsetIn(union));
    }

    @Test
    void misalignedGridsAreRejected () {
        GridSpec shifted = new GridSpec("EPSG:5070", 0.5, 100, 1, 1, 10, 10);
        GridSpec otherCrs = new GridSpec("EPSG:26915", 0, 100, 1, 1, 10, 10);
        assertFalse(GRID.alignedWith(shifted));
        assertFalse(GRID.alignedWith(otherCrs));
        assertThrows(RasterException.class, () -> GRID.encompass(shifted));
    }

    @Test
    void cellSizeMustBePositive () {
        assertThrows(IllegalArgumentException.class, () -> new GridSpec("EPSG:5070", 0, 0, 0, 1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new GridSpec("EPSG:5070", 0, 0, 1, 1, 0, 1));
    }

}
