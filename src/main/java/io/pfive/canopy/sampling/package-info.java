// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Ground truth points for accuracy assessment.
package io.pfive.canopy.sampling;
