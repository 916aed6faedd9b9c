// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageLedgerTest {

    @TempDir
    Path tempDir;

    @Test
    void statusesOnlyAdvanceAndArePersisted () {
        Path path = tempDir.resolve("region").resolve(StagingLayout.LEDGER_FILE);
        StageLedger ledger = StageLedger.load(path);
        assertEquals(StageStatus.PENDING, ledger.status("a.tif"));
        ledger.record("a.tif", StageStatus.CLIPPED);
        ledger.record("a.tif", StageStatus.REPROJECTED);
        ledger.recordRegion(StageStatus.MOSAICKED);
        assertTrue(Files.exists(path));

        StageLedger reloaded = StageLedger.load(path);
        assertEquals(StageStatus.CLIPPED, reloaded.status("a.tif"));
        assertEquals(StageStatus.MOSAICKED, reloaded.regionStatus());
        assertEquals(StageStatus.PENDING, reloaded.status("b.tif"));
    }

    @Test
    void outputIsDoneOnlyIfItExistsAndIsRecorded () {
        StageLedger ledger = StageLedger.load(tempDir.resolve(StagingLayout.LEDGER_FILE));
        ledger.record("a.tif", StageStatus.CLASSIFIED);
        assertTrue(ledger.isDone("a.tif", StageStatus.REPROJECTED, true, false));
        assertTrue(ledger.isDone("a.tif", StageStatus.CLASSIFIED, true, false));
        assertFalse(ledger.isDone("a.tif", StageStatus.CLIPPED, true, false));
        // A recorded output that has since been deleted must be produced again.
        assertFalse(ledger.isDone("a.tif", StageStatus.CLASSIFIED, false, true));
    }

    @Test
    void unrecordedOutputsAreAdoptedOnlyWhenTrusted () {
        Path path = tempDir.resolve(StagingLayout.LEDGER_FILE);
        StageLedger ledger = StageLedger.load(path);
        assertFalse(ledger.isDone("b.tif", StageStatus.REPROJECTED, true, false));
        assertEquals(StageStatus.PENDING, ledger.status("b.tif"));
        assertTrue(ledger.isDone("b.tif", StageStatus.REPROJECTED, true, true));
        assertEquals(StageStatus.REPROJECTED, StageLedger.load(path).status("b.tif"));

        assertFalse(ledger.isRegionDone(StageStatus.MOSAICKED, true, false));
        assertTrue(ledger.isRegionDone(StageStatus.MOSAICKED, true, true));
        assertEquals(StageStatus.MOSAICKED, ledger.regionStatus());
    }

    @Test
    void namingFollowsTheStagePrefixes () {
        assertEquals("rm_1.tif", StageNaming.reprojected("m_1.tif"));
        assertEquals("frm_1.tif", StageNaming.finalTile("m_1.tif"));
        assertEquals("cfrm_1.tif", StageNaming.clippedTile("m_1.tif"));
        assertEquals("corrected_canopy_2014_Delta_Plain.tif", StageNaming.correctedCanopy(2014, "Delta_Plain"));
        assertEquals("gtpoints_2014_Delta_Plain.geojson", StageNaming.groundTruthPoints(2014, "Delta_Plain"));
        assertEquals("GT_2016", StageNaming.groundTruthField(2016));
        assertEquals("rm_1", StageNaming.baseName("rm_1.tif"));
    }

}
