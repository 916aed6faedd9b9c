// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import org.locationtech.jts.geom.Geometry;

/// A physiographic region, the unit of final output. The boundary is in the analysis coordinate
/// system.
public record Region (int id, String name, Geometry boundary, double areaSqKm) {

    /// The name as used in folder and file names. Some GIS tools reject spaces and hyphens in
    /// file names, so both become underscores.
    public String stagingName () {
        return stagingName(name);
    }

    public static String stagingName (String name) {
        return name.replace(' ', '_').replace('-', '_');
    }

    @Override
    public String toString () {
        return String.format("region %d (%s)", id, name);
    }

}
