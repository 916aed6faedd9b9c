// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassCodesTest {

    private static final GridSpec GRID = new GridSpec("EPSG:5070", 0, 2, 1, 1, 2, 2);

    @Test
    void transitionalCodesAreRecoded () {
        assertEquals(ClassCodes.NON_CANOPY, ClassCodes.fromTransitional(1));
        assertEquals(ClassCodes.CANOPY, ClassCodes.fromTransitional(2));
        assertEquals(ClassCodes.NO_DATA, ClassCodes.fromTransitional(0));
        assertEquals(ClassCodes.NO_DATA, ClassCodes.fromTransitional(15));
    }

    @Test
    void recodedRasterUsesCanonicalNoData () {
        GridRaster transitional = GridRaster.create(GRID, 1, null);
        transitional.set(0, 0, 1);
        transitional.set(0, 1, 2);
        transitional.set(1, 0, 0);
        transitional.set(1, 1, 2);
        GridRaster canonical = ClassCodes.fromTransitional(transitional);
        assertEquals(Integer.valueOf(ClassCodes.NO_DATA), canonical.noData);
        assertEquals(ClassCodes.NON_CANOPY, canonical.get(0, 0));
        assertEquals(ClassCodes.CANOPY, canonical.get(0, 1));
        assertEquals(ClassCodes.NO_DATA, canonical.get(1, 0));
        assertEquals(2, canonical.count(ClassCodes.CANOPY));
    }

    @Test
    void invertingTwiceRestoresTheRaster () {
        GridRaster raster = GridRaster.create(GRID, 1, ClassCodes.NO_DATA);
        raster.set(0, 0, ClassCodes.CANOPY);
        raster.set(0, 1, ClassCodes.NON_CANOPY);
        raster.set(1, 0, ClassCodes.CANOPY);
        GridRaster inverted = ClassCodes.invert(raster);
        assertEquals(ClassCodes.NON_CANOPY, inverted.get(0, 0));
        assertEquals(ClassCodes.CANOPY, inverted.get(0, 1));
        assertEquals(ClassCodes.NO_DATA, inverted.get(1, 1));
        assertEquals(raster.noData, inverted.noData);
        assertTrue(ClassCodes.invert(inverted).sameSamples(raster));
    }

    @Test
    void invertingLeavesOtherValuesAlone () {
        for (int v = -2; v < 10; v++) {
            assertEquals(v, ClassCodes.invert(ClassCodes.invert(v)));
        }
        assertEquals(ClassCodes.NO_DATA, ClassCodes.invert(ClassCodes.NO_DATA));
    }

}
