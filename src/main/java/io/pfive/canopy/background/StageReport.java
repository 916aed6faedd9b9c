// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.background;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Tally of what one invocation of a stage did with each item (tile or region) it considered.
/// Stages never abort over a single missing input, so this is where such omissions end up besides
/// the log. Not threadsafe: stages run sequentially.
public class StageReport {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public final String stage;
    private final long startTime = System.currentTimeMillis();
    private int written;
    private int alreadyDone;
    private final List<String> missing = new ArrayList<>();

    public StageReport (String stage) {
        this.stage = stage;
    }

    public void written () {
        written += 1;
    }

    public void alreadyDone () {
        alreadyDone += 1;
    }

    /// Record an item that could not be processed because one of its inputs does not exist.
    public void missing (String item, String reason) {
        LOG.warn("{}: skipping {}, {}", stage, item, reason);
        missing.add(item);
    }

    public int nWritten () {
        return written;
    }

    public int nAlreadyDone () {
        return alreadyDone;
    }

    public List<String> missingItems () {
        return Collections.unmodifiableList(missing);
    }

    public void logSummary () {
        LOG.info("{}: {} written, {} already done, {} missing inputs ({} sec)",
              stage, written, alreadyDone, missing.size(), (System.currentTimeMillis() - startTime) / 1000.0);
    }

    @Override
    public String toString () {
        return "%s[written=%d, alreadyDone=%d, missing=%d]".formatted(stage, written, alreadyDone, missing.size());
    }

}
