// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// The pipeline stages and their bookkeeping. Each stage is a class with one method taking a set
/// of region ids, which does whatever has not been done yet for those regions and returns a
/// StageReport. Where files go is decided by StagingLayout and StageNaming, and what is done by
/// the StageLedger kept in each region's folder.
package io.pfive.canopy.stage;
