// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.stage;

/// Names of the files each stage produces. Per-tile outputs are the imagery file name with a
/// stage prefix. Per-region outputs carry the analysis year and the region's staging name.
public abstract class StageNaming {

    public static final String REPROJECTED_PREFIX = "r";
    public static final String FINAL_PREFIX = "fr";
    public static final String CLIPPED_PREFIX = "cfr";

    public static String reprojected (String sourceFileName) {
        return REPROJECTED_PREFIX + sourceFileName;
    }

    public static String finalTile (String sourceFileName) {
        return FINAL_PREFIX + sourceFileName;
    }

    public static String clippedTile (String sourceFileName) {
        return CLIPPED_PREFIX + sourceFileName;
    }

    public static String mosaic (int year, String regionName) {
        return String.format("mosaic_%d_%s.tif", year, regionName);
    }

    public static String canopy (int year, String regionName) {
        return String.format("canopy_%d_%s.tif", year, regionName);
    }

    public static String correctedCanopy (int year, String regionName) {
        return "corrected_" + canopy(year, regionName);
    }

    public static String canopyPolygons (int year, String regionName) {
        return String.format("poly_canopy_%d_%s.geojson", year, regionName);
    }

    public static String quicklook (int year, String regionName) {
        return String.format("canopy_%d_%s.png", year, regionName);
    }

    public static String groundTruthPoints (int year, String regionName) {
        return String.format("gtpoints_%d_%s.geojson", year, regionName);
    }

    public static String groundTruthField (int year) {
        return "GT_" + year;
    }

    /// File name without its extension, for finding sibling files in other formats.
    public static String baseName (String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }

}
