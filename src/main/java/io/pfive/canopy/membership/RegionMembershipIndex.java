// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import io.pfive.canopy.background.ProgressListener;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Records on every tile of the tile layer which regions its footprint intersects, and on every
/// region its area. Both fields are recomputed from scratch on each run rather than merged with what
/// was there, so running this again after the region or tile layer changes is always safe.
///
/// Region ids are appended in ascending order, so each tile's membership text is sorted.
public class RegionMembershipIndex {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final RegionLayer regionLayer;
    private final TileLayer tileLayer;
    private final ProgressListener progress;

    public RegionMembershipIndex (RegionLayer regionLayer, TileLayer tileLayer, ProgressListener progress) {
        this.regionLayer = regionLayer;
        this.tileLayer = tileLayer;
        this.progress = progress;
    }

    private record IndexedRegion (Region region, PreparedGeometry boundary) { }

    /// Compute and save region areas and tile memberships. Returns the number of tiles that
    /// intersect at least one region.
    public int assign () {
        regionLayer.recomputeAreas();
        STRtree index = new STRtree();
        for (Region region : regionLayer.regions()) {
            PreparedGeometry prepared = PreparedGeometryFactory.prepare(region.boundary());
            index.insert(region.boundary().getEnvelopeInternal(), new IndexedRegion(region, prepared));
        }
        index.build();

        tileLayer.clearMembership();
        List<Tile> tiles = tileLayer.tiles();
        progress.beginTask("Assigning regions to tiles", tiles.size());
        int nAssigned = 0;
        for (int i = 0; i < tiles.size(); i++) {
            Tile tile = tiles.get(i);
            List<IndexedRegion> candidates = new ArrayList<>();
            for (Object item : index.query(tile.footprint().getEnvelopeInternal())) {
                candidates.add((IndexedRegion) item);
            }
            candidates.sort(Comparator.comparingInt(c -> c.region().id()));
            RegionSet regions = RegionSet.empty();
            for (IndexedRegion candidate : candidates) {
                if (candidate.boundary().intersects(tile.footprint())) {
                    regions.add(candidate.region().id());
                }
            }
            tileLayer.setMembership(i, regions);
            if (!regions.isEmpty()) nAssigned += 1;
            progress.increment();
        }
        regionLayer.save();
        tileLayer.save();
        LOG.info("{} of {} tiles intersect at least one of {} regions.", nAssigned, tiles.size(), regionLayer.regions().size());
        return nAssigned;
    }

}
