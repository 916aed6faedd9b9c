// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Progress reporting and per-stage accounting for the batch stages. Stages can run for tens of
/// minutes per region, so they report through these classes rather than staying silent.
package io.pfive.canopy.background;
