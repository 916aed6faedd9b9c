// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.membership.Region;

import java.util.Optional;

/// Producer of per-tile classification artifacts. Classification happens outside this system, by
/// hand or with a separate feature extraction tool, between reprojection and conversion. This is
/// the point where its results are handed back.
public interface ClassificationSource {

    /// Find the classification of the reprojected tile with the given file name, if it has been
    /// produced.
    Optional<ClassificationArtifact> find (Region region, String reprojectedTileName);

}
