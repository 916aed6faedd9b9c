// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Vector layers (regions, tile footprints, classification polygons, sample points) as simple
/// ordered lists of JTS geometries with attributes, stored as GeoJSON.
package io.pfive.canopy.vector;
