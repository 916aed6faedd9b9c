// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Regions, imagery tiles, and which tiles belong to which regions.
package io.pfive.canopy.membership;
