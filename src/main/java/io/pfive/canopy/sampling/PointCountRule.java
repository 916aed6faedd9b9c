// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.sampling;

import com.google.common.base.Preconditions;

/// How many ground truth points a region gets, interpolated linearly from its area between a
/// minimum and maximum point count. Regions at or below the minimum area get the minimum count,
/// regions at or above the maximum area get the maximum count. Bounds given in the wrong order are
/// swapped.
public class PointCountRule {

    public final double minArea;
    public final double maxArea;
    public final int minPoints;
    public final int maxPoints;

    public PointCountRule (double minArea, double maxArea, int minPoints, int maxPoints) {
        Preconditions.checkArgument(minPoints >= 0 && maxPoints >= 0, "Point counts must not be negative.");
        this.minArea = Math.min(minArea, maxArea);
        this.maxArea = Math.max(minArea, maxArea);
        this.minPoints = Math.min(minPoints, maxPoints);
        this.maxPoints = Math.max(minPoints, maxPoints);
    }

    public int count (double areaSqKm) {
        if (maxArea == minArea) {
            return areaSqKm >= maxArea ? maxPoints : minPoints;
        }
        double slope = (double) (maxPoints - minPoints) / (maxArea - minArea);
        int n = (int) Math.floor(minPoints + slope * (areaSqKm - minArea) + 1);
        return Math.max(minPoints, Math.min(maxPoints, n));
    }

    @Override
    public String toString () {
        return String.format("%d to %d points for %.1f to %.1f square km", minPoints, maxPoints, minArea, maxArea);
    }

}
