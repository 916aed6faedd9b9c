// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import java.nio.file.Path;

/// A classification of one reprojected tile, as delivered by the classification tool.
public record ClassificationArtifact (Kind kind, Path path) {

    public enum Kind {
        /// Polygons carrying a CLASS_ID attribute, in canonical codes.
        POLYGONS,
        /// A raster in the tool's transitional codes.
        RASTER
    }

}
