// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import org.locationtech.jts.geom.Geometry;

/// One imagery tile from the tile index layer. The object id is stable for a given index layer
/// and is how a tile's own footprint is found again when clipping.
public record Tile (int objectId, String fileName, Geometry footprint, RegionSet regions) {

    /// False when the index row does not name a NAIP quarter quadrangle, in which case there is
    /// no imagery file to stage for it.
    public boolean hasNaipName () {
        return NaipTileName.tryParse(fileName).isPresent();
    }

    public NaipTileName naipName () {
        return NaipTileName.parse(fileName);
    }

    /// Name of the imagery file, which every staged output name is derived from.
    public String sourceFileName () {
        return naipName().sourceFileName();
    }

    @Override
    public String toString () {
        return String.format("tile %d (%s)", objectId, fileName);
    }

}
