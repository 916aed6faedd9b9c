// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TIntArrayList;

/// An ordered set of region ids without duplicates. This is the set of regions a tile intersects,
/// and also the set of regions a command is asked to process. Containment tests are on whole ids,
/// so region 1 never matches region 12.
///
/// Stored in the tile layer as text with every id enclosed in commas, like `,3,7,12,`, so that
/// even plain substring queries against the layer (`like '%,1,%'`) cannot confuse ids. The empty
/// set is stored as a single comma.
public final class RegionSet {

    private static final char DELIMITER = ',';

    private final TIntArrayList ids;

    private RegionSet (TIntArrayList ids) {
        this.ids = ids;
    }

    public static RegionSet empty () {
        return new RegionSet(new TIntArrayList());
    }

    public static RegionSet of (int... ids) {
        RegionSet set = empty();
        for (int id : ids) set.add(id);
        return set;
    }

    /// Parse either the stored form `,3,7,` or a plain list `3,7` as typed on the command line.
    /// Null and blank text give the empty set.
    public static RegionSet parse (String text) {
        RegionSet set = empty();
        if (text == null) return set;
        for (String token : text.split(String.valueOf(DELIMITER))) {
            token = token.strip();
            if (token.isEmpty()) continue;
            try {
                set.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Region id '%s' in '%s' is not an integer.", token, text), e);
            }
        }
        return set;
    }

    /// Add an id to the end of the set. Returns false if it was already present.
    public boolean add (int id) {
        if (ids.contains(id)) return false;
        ids.add(id);
        return true;
    }

    public boolean contains (int id) {
        return ids.contains(id);
    }

    public boolean containsAny (RegionSet other) {
        for (int i = 0; i < other.ids.size(); i++) {
            if (ids.contains(other.ids.get(i))) return true;
        }
        return false;
    }

    public int size () {
        return ids.size();
    }

    public boolean isEmpty () {
        return ids.isEmpty();
    }

    public int get (int index) {
        Preconditions.checkElementIndex(index, ids.size());
        return ids.get(index);
    }

    public int[] toArray () {
        return ids.toArray();
    }

    /// The stored form, with every id enclosed in delimiters.
    public String format () {
        StringBuilder sb = new StringBuilder().append(DELIMITER);
        for (int i = 0; i < ids.size(); i++) {
            sb.append(ids.get(i)).append(DELIMITER);
        }
        return sb.toString();
    }

    @Override
    public boolean equals (Object other) {
        return other instanceof RegionSet regionSet && ids.equals(regionSet.ids);
    }

    @Override
    public int hashCode () {
        return ids.hashCode();
    }

    @Override
    public String toString () {
        return format();
    }

}
