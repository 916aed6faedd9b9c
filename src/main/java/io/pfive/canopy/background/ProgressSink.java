// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.background;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// Stores progress information, occasionally writing an update to the log.
/// Stages over thousands of tiles would flood the log if every step were reported, so messages are
/// throttled both by number of steps and by elapsed time.
public class ProgressSink implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    // Parameters affecting the maximum number and frequency of log messages for a single task.
    private static final int DEFAULT_MAX_EVENTS = 20;
    private static final int DEFAULT_MIN_MSEC = 5000;

    // Tracking current state of the task.
    private String title = "UNKNOWN";
    private int totalSteps = 1;
    private int stepsCompleted = 0;
    private boolean completed = false;
    private long startTime;

    // Variables used in throttling log messages.
    private int prevLogStep = 0;
    private int logAfter = 0;
    private long lastLogTime = 0;
    private int msecBetweenEvents = DEFAULT_MIN_MSEC;

    public void minTimeBetweenEventsMsec (int msec) {
        this.msecBetweenEvents = msec;
    }

    private int estimateRemainingSeconds (long currentTime) {
        if (stepsCompleted == 0) return 0;
        double activeTimeSeconds = (currentTime - this.startTime) / 1000.0;
        double stepsRemaining = totalSteps - stepsCompleted;
        return (int)(activeTimeSeconds * stepsRemaining / stepsCompleted);
    }

    @Override
    public void beginTask (String title, int totalSteps) {
        this.title = title;
        this.totalSteps = totalSteps;
        this.stepsCompleted = 0;
        this.completed = false;
        this.startTime = System.currentTimeMillis();
        this.lastLogTime = startTime;
        // Throttling will still function if totalSteps <= MAX_EVENTS and logAfter is zero.
        logAfter = totalSteps / DEFAULT_MAX_EVENTS;
        prevLogStep = 0;
        LOG.info("{}: {} steps", title, totalSteps);
    }

    @Override
    public void increment (int i) {
        if (completed) return;
        stepsCompleted += i;
        long currTime = System.currentTimeMillis();
        if (stepsCompleted >= totalSteps) {
            completed = true;
            LOG.info("{}: done in {} sec", title, (currTime - startTime) / 1000);
        } else if (stepsCompleted >= prevLogStep + logAfter) {
            if (currTime - lastLogTime < msecBetweenEvents) return;
            LOG.info("{}: {} of {}, about {} sec remaining", title, stepsCompleted, totalSteps,
                  estimateRemainingSeconds(currTime));
            prevLogStep = stepsCompleted;
            lastLogTime = currTime;
        }
    }

    public boolean isCompleted () {
        return completed;
    }

}
