// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.store.FileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/// Persistent record of which stages have completed for one region, kept as JSON in the region's
/// staging folder. Items are tiles (keyed by imagery file name) and intermediate per-region files
/// (keyed by file name). Statuses only ever advance.
///
/// An output is done when its file exists and the ledger says so. The file alone is not enough,
/// since a file could have been left by a run killed before it was recorded or produced by hand.
/// Outputs from before the ledger existed can be adopted: when trusting existing outputs, an
/// unrecorded file counts as done and is recorded. The ledger is saved after every change, so a
/// run killed partway loses at most the item it was working on.
public class StageLedger {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// The serialized form.
    public static class Entries {
        public StageStatus region = StageStatus.PENDING;
        public Map<String, StageStatus> items = new TreeMap<>();
        public String updated;
    }

    private final Path path;
    private final Entries entries;

    private StageLedger (Path path, Entries entries) {
        this.path = path;
        this.entries = entries;
    }

    public static StageLedger load (Path path) {
        if (Files.exists(path)) {
            Entries entries = FileStore.readJson(path, Entries.class);
            if (entries.items == null) entries.items = new TreeMap<>();
            if (entries.region == null) entries.region = StageStatus.PENDING;
            return new StageLedger(path, entries);
        }
        return new StageLedger(path, new Entries());
    }

    public StageStatus status (String item) {
        return entries.items.getOrDefault(item, StageStatus.PENDING);
    }

    public StageStatus regionStatus () {
        return entries.region;
    }

    public void record (String item, StageStatus status) {
        if (status(item).atLeast(status)) return;
        entries.items.put(item, status);
        save();
    }

    public void recordRegion (StageStatus status) {
        if (entries.region.atLeast(status)) return;
        entries.region = status;
        save();
    }

    /// Whether an item's output for the given stage can be skipped, adopting it into the ledger if
    /// it exists unrecorded and existing outputs are trusted.
    public boolean isDone (String item, StageStatus stage, boolean outputExists, boolean trustExisting) {
        if (!outputExists) return false;
        if (status(item).atLeast(stage)) return true;
        if (!trustExisting) {
            LOG.info("{} exists but is not recorded as {}, it will be produced again.", item, stage);
            return false;
        }
        LOG.debug("Adopting existing output for {} as {}", item, stage);
        record(item, stage);
        return true;
    }

    /// Like isDone, for the region as a whole.
    public boolean isRegionDone (StageStatus stage, boolean outputExists, boolean trustExisting) {
        if (!outputExists) return false;
        if (regionStatus().atLeast(stage)) return true;
        if (!trustExisting) {
            LOG.info("Region output exists but is not recorded as {}, it will be produced again.", stage);
            return false;
        }
        recordRegion(stage);
        return true;
    }

    private void save () {
        entries.updated = Instant.now().toString();
        FileStore.writeJson(entries, path);
    }

}
