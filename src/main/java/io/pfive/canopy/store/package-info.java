// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Writing finished files into the results tree, and the JSON used for sidecars and ledgers.
/// This is simply backed by the filesystem.
package io.pfive.canopy.store;
