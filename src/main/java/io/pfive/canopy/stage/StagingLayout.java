// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

import io.pfive.canopy.Configuration;
import io.pfive.canopy.membership.Region;
import io.pfive.canopy.membership.Tile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/// Where every input and output of the pipeline lives. Source imagery is under the imagery root in
/// one folder per five digit quadrangle block. Results are under the results root in one folder per
/// region, holding an Inputs folder of reprojected imagery and an Outputs folder of classification
/// artifacts and everything derived from them.
public class StagingLayout {

    public static final String INPUTS = "Inputs";
    public static final String OUTPUTS = "Outputs";
    public static final String LEDGER_FILE = "stage-status.json";

    public final Path naipRoot;
    public final Path resultsRoot;
    public final int year;

    public StagingLayout (Path naipRoot, Path resultsRoot, int year) {
        this.naipRoot = naipRoot;
        this.resultsRoot = resultsRoot;
        this.year = year;
    }

    public StagingLayout (Configuration config) {
        this(config.naipPath, config.resultsPath, config.analysisYear);
    }

    public Path sourceImagery (Tile tile) {
        return naipRoot.resolve(tile.naipName().quadFolder()).resolve(tile.sourceFileName());
    }

    public Path regionDir (Region region) {
        return resultsRoot.resolve(region.stagingName());
    }

    public Path inputsDir (Region region) {
        return regionDir(region).resolve(INPUTS);
    }

    public Path outputsDir (Region region) {
        return regionDir(region).resolve(OUTPUTS);
    }

    public Path ledgerPath (Region region) {
        return regionDir(region).resolve(LEDGER_FILE);
    }

    public StageLedger ledger (Region region) {
        return StageLedger.load(ledgerPath(region));
    }

    public Path reprojectedTile (Region region, Tile tile) {
        return inputsDir(region).resolve(StageNaming.reprojected(tile.sourceFileName()));
    }

    public Path finalTile (Region region, Tile tile) {
        return outputsDir(region).resolve(StageNaming.finalTile(tile.sourceFileName()));
    }

    public Path clippedTile (Region region, Tile tile) {
        return outputsDir(region).resolve(StageNaming.clippedTile(tile.sourceFileName()));
    }

    public Path mosaic (Region region) {
        return outputsDir(region).resolve(StageNaming.mosaic(year, region.stagingName()));
    }

    public Path canopy (Region region) {
        return outputsDir(region).resolve(StageNaming.canopy(year, region.stagingName()));
    }

    public Path correctedCanopy (Region region) {
        return outputsDir(region).resolve(StageNaming.correctedCanopy(year, region.stagingName()));
    }

    /// The corrected canopy raster if there is one, otherwise the canopy raster as mosaicked.
    public Path finalCanopy (Region region) {
        Path corrected = correctedCanopy(region);
        return Files.exists(corrected) ? corrected : canopy(region);
    }

    public Path canopyPolygons (Region region) {
        return outputsDir(region).resolve(StageNaming.canopyPolygons(year, region.stagingName()));
    }

    public Path quicklook (Region region) {
        return outputsDir(region).resolve(StageNaming.quicklook(year, region.stagingName()));
    }

    public Path groundTruthPoints (Region region) {
        return outputsDir(region).resolve(StageNaming.groundTruthPoints(year, region.stagingName()));
    }

    /// The same layout for another analysis year, for carrying ground truth points forward.
    public StagingLayout forYear (Path otherResultsRoot, int otherYear) {
        return new StagingLayout(naipRoot, otherResultsRoot, otherYear);
    }

    /// Post-classification stages only run for regions whose Outputs folder has something in it,
    /// since anything else means classification has not been done there yet.
    public boolean hasOutputs (Region region) {
        Path outputs = outputsDir(region);
        if (!Files.isDirectory(outputs)) return false;
        try (Stream<Path> entries = Files.list(outputs)) {
            return entries.findAny().isPresent();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

}
