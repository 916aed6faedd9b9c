// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NaipTileNameTest {

    @Test
    void tileIndexNameDropsPublicationDate () {
        NaipTileName name = NaipTileName.parse("m_3608906_ne_15_1_20140527_20141001.tif");
        assertEquals("36089", name.quadFolder());
        assertEquals("06", name.cell());
        assertEquals("ne", name.quadrant());
        assertEquals(15, name.utmZone());
        assertEquals("1", name.resolution());
        assertEquals("20140527", name.acquisitionDate());
        assertEquals("m_3608906_ne_15_1_20140527.tif", name.sourceFileName());
        assertEquals("EPSG:26915", name.utmCrs());
    }

    @Test
    void resolutionWithLeadingZerosIsKept () {
        NaipTileName name = NaipTileName.parse("m_3008601_ne_16_060_20181012_20190102.tif");
        assertEquals("060", name.resolution());
        assertEquals("m_3008601_ne_16_060_20181012.tif", name.sourceFileName());
        assertEquals("EPSG:26916", name.utmCrs());
    }

    @Test
    void nameWithoutExtensionOrPublicationDate () {
        NaipTileName name = NaipTileName.parse("M_3409101_SW_15_1_20150620");
        assertEquals("M_3409101_SW_15_1_20150620.tif", name.sourceFileName());
        assertEquals("sw", name.quadrant());
    }

    @Test
    void singleDigitZoneIsKeptAsWritten () {
        NaipTileName name = NaipTileName.parse("m_4412301_nw_5_1_20160801.tif");
        assertEquals("m_4412301_nw_5_1_20160801.tif", name.sourceFileName());
        assertEquals("EPSG:26905", name.utmCrs());
    }

    @Test
    void stagePrefixedNamesAreNotImagery () {
        assertTrue(NaipTileName.tryParse("rm_3608906_ne_15_1_20140527.tif").isEmpty());
        assertTrue(NaipTileName.tryParse("cfrm_3608906_ne_16_060_20140527.tif").isEmpty());
        assertTrue(NaipTileName.tryParse("canopy_2014_Ozark.tif").isEmpty());
    }

    @Test
    void otherNamesAreRejected () {
        assertTrue(NaipTileName.tryParse("ortho_1-1_1n_s_ar001_2014_1.tif").isEmpty());
        assertTrue(NaipTileName.tryParse(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> NaipTileName.parse("m_36089_ne_15_1_20140527.tif"));
        assertThrows(IllegalArgumentException.class, () -> NaipTileName.parse(null));
    }

    @Test
    void tileKnowsWhetherItNamesImagery () {
        assertTrue(new Tile(1, "m_3608906_ne_15_1_20140527_20141001.tif", null, RegionSet.of(1)).hasNaipName());
        assertFalse(new Tile(2, "ortho_2014_1.tif", null, RegionSet.of(1)).hasNaipName());
        assertFalse(new Tile(3, null, null, RegionSet.of(1)).hasNaipName());
    }

}
