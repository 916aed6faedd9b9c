// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Coordinate reference systems and reprojection of vector geometries, on top of proj4j and JTS.
package io.pfive.canopy.geo;
