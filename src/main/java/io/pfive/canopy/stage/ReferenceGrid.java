// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.membership.Tile;
import io.pfive.canopy.raster.GridRaster;
import io.pfive.canopy.raster.GridSpec;
import io.pfive.canopy.raster.RasterException;
import io.pfive.canopy.raster.RasterStore;
import io.pfive.canopy.raster.Resampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// The grid every raster in the pipeline is aligned to, defined by the snap raster. Once the snap
/// raster exists it is simply read. When it does not exist yet, one imagery tile is reprojected
/// into the analysis coordinate system and saved as the snap raster, fixing the grid for this and
/// all later runs. The tile used is the one whose name the snap raster's file name follows (the
/// reprojected prefix plus the imagery name), if that tile is available, otherwise the first
/// candidate whose imagery can be read.
public class ReferenceGrid {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Path snapRaster;
    private final String targetCrs;
    private final StagingLayout layout;
    private final RasterStore store;
    private GridSpec grid;

    public ReferenceGrid (Path snapRaster, String targetCrs, StagingLayout layout, RasterStore store) {
        this.snapRaster = snapRaster;
        this.targetCrs = targetCrs;
        this.layout = layout;
        this.store = store;
    }

    /// Return the reference grid, creating the snap raster from one of the candidate tiles if needed.
    /// @throws RasterException if there is no snap raster and none of the candidates can be read.
    public GridSpec resolve (List<Tile> candidates) {
        if (grid != null) return grid;
        if (store.exists(snapRaster)) {
            grid = store.readGrid(snapRaster);
            LOG.info("Using reference grid from {}", snapRaster);
            return grid;
        }
        for (Tile tile : orderCandidates(candidates)) {
            Path source = layout.sourceImagery(tile);
            if (!Files.exists(source)) continue;
            GridRaster imagery;
            try {
                imagery = store.read(source);
            } catch (RasterException e) {
                LOG.warn("Cannot use {} to define the reference grid: {}", source, e.getMessage());
                continue;
            }
            GridSpec projected = Resampler.projectedGrid(imagery.grid, targetCrs);
            GridRaster reference = Resampler.resampleOnto(imagery, projected);
            store.write(reference, snapRaster, source.getFileName().toString());
            LOG.info("Created reference grid {} from {}", snapRaster, source);
            grid = projected;
            return grid;
        }
        throw new RasterException("Snap raster " + snapRaster + " does not exist and none of "
              + candidates.size() + " candidate tiles could be read to create it.");
    }

    /// Put the tile named by the snap raster file name first, if it is among the candidates.
    /// Tiles without imagery names cannot be read and are left out.
    private List<Tile> orderCandidates (List<Tile> allCandidates) {
        List<Tile> candidates = allCandidates.stream().filter(Tile::hasNaipName).toList();
        String snapName = snapRaster.getFileName().toString();
        Optional<Tile> named = Optional.empty();
        if (snapName.startsWith(StageNaming.REPROJECTED_PREFIX)) {
            String sourceName = snapName.substring(StageNaming.REPROJECTED_PREFIX.length());
            named = candidates.stream().filter(t -> t.sourceFileName().equals(sourceName)).findFirst();
        }
        List<Tile> ordered = new ArrayList<>();
        named.ifPresent(ordered::add);
        for (Tile tile : candidates) {
            if (!ordered.contains(tile)) ordered.add(tile);
        }
        return ordered;
    }

}
