// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.membership.Region;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/// Finds classification artifacts where the classification tool is told to save them: in the
/// region's Outputs folder, named after the reprojected tile. Polygons take precedence over a
/// raster when both exist.
public class StagedClassificationSource implements ClassificationSource {

    public static final String POLYGON_EXTENSION = ".geojson";

    private final StagingLayout layout;

    public StagedClassificationSource (StagingLayout layout) {
        this.layout = layout;
    }

    @Override
    public Optional<ClassificationArtifact> find (Region region, String reprojectedTileName) {
        Path outputs = layout.outputsDir(region);
        Path polygons = outputs.resolve(StageNaming.baseName(reprojectedTileName) + POLYGON_EXTENSION);
        if (Files.exists(polygons)) {
            return Optional.of(new ClassificationArtifact(ClassificationArtifact.Kind.POLYGONS, polygons));
        }
        Path raster = outputs.resolve(reprojectedTileName);
        if (Files.exists(raster)) {
            return Optional.of(new ClassificationArtifact(ClassificationArtifact.Kind.RASTER, raster));
        }
        return Optional.empty();
    }

}
