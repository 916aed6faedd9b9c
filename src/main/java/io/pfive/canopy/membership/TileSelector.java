// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.ArrayList;
import java.util.List;

/// Answers which tiles take part in processing a set of regions, using the membership recorded
/// by RegionMembershipIndex. Results are always in tile layer order, so repeating a query on an
/// unchanged layer gives the same list in the same order.
public class TileSelector {

    private final TileLayer tileLayer;

    public TileSelector (TileLayer tileLayer) {
        this.tileLayer = tileLayer;
    }

    /// Tiles whose membership includes at least one of the given regions.
    /// @throws io.pfive.canopy.vector.SchemaException if membership has never been assigned.
    public List<Tile> select (RegionSet regionIds) {
        tileLayer.requireMembership();
        List<Tile> selected = new ArrayList<>();
        for (Tile tile : tileLayer.tiles()) {
            if (tile.regions().containsAny(regionIds)) selected.add(tile);
        }
        return selected;
    }

    public List<Tile> tilesForRegion (int regionId) {
        return select(RegionSet.of(regionId));
    }

    /// Tiles whose footprint intersects the geometry, which must be in the analysis coordinate
    /// system. This uses footprints directly and does not need membership to have been assigned.
    public List<Tile> tilesIntersecting (Geometry geometry) {
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
        List<Tile> selected = new ArrayList<>();
        for (Tile tile : tileLayer.tiles()) {
            if (prepared.intersects(tile.footprint())) selected.add(tile);
        }
        return selected;
    }

}
