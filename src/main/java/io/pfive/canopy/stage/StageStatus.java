// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

/// How far processing has progressed, for one tile within one region or for a region as a whole.
/// Declared in pipeline order, so a later status implies every earlier one.
public enum StageStatus {
    PENDING, REPROJECTED, CLASSIFIED, CLIPPED, MOSAICKED, CORRECTED;

    public boolean atLeast (StageStatus other) {
        return this.compareTo(other) >= 0;
    }
}
