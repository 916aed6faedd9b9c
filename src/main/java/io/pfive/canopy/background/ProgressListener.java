// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.background;

/// Receives progress updates from long-running stages. A stage announces how many steps it
/// expects (usually one per tile or per region) and then reports each step as it finishes.
public interface ProgressListener {

    void beginTask (String title, int totalSteps);

    void increment (int n);

    default void increment () {
        increment(1);
    }

    /// A listener that discards everything, for tests and for callers that don't care.
    ProgressListener NONE = new ProgressListener() {
        @Override
        public void beginTask (String title, int totalSteps) { }

        @Override
        public void increment (int n) { }
    };

}
