// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

/// Position of one cell, counting rows down from the top edge and columns right from the left edge.
public record RowColumn (int row, int col) { }
