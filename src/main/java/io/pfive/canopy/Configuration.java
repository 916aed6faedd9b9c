// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy;

import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalLong;
import java.util.Properties;

/// Paths, layer names and field names for one analysis, read once from a properties file.
/// Unlike a global settings object this is an immutable value handed to each component when it is
/// constructed. To pick up edits to the file, load a new instance and rebuild the components from
/// it (see CanopyPipeline#reload) rather than changing anything in place.
/// Values are only checked for presence and syntax here. Whether the files and fields they name
/// actually exist is discovered by the stages that use them.
public final class Configuration {

    public final Path regionLayer;
    public final String regionIdField;
    public final String regionNameField;
    public final String regionAreaField;

    public final Path tileLayer;
    public final String tileFileNameField;
    public final String tileRegionsField;

    /// Root of the USDA imagery folder structure: one five-digit quadrangle folder per group of tiles.
    public final Path naipPath;
    public final String targetCrs;

    /// The snap raster defining the reference grid. If it does not exist yet, its file name should
    /// be "r" followed by the name of an existing imagery tile, from which it will be created.
    public final Path snapRaster;
    public final Path resultsPath;
    public final int analysisYear;

    /// Whether an output file that exists but was never recorded in a status ledger counts as done.
    public final boolean trustExistingOutputs;
    public final boolean mosaicPartialRegions;
    public final boolean writeQuicklook;
    public final OptionalLong randomSeed;

    private final Path source;

    private Configuration (Properties properties, Path source) {
        this.source = source;
        regionLayer = pathVal(properties, "region-layer");
        regionIdField = stringVal(properties, "region-id-field", "PHYSIO_ID");
        regionNameField = stringVal(properties, "region-name-field", "NAME");
        regionAreaField = stringVal(properties, "region-area-field", "AREA_SQKM");
        tileLayer = pathVal(properties, "tile-layer");
        tileFileNameField = stringVal(properties, "tile-filename-field", "FileName");
        tileRegionsField = stringVal(properties, "tile-regions-field", "PHYREGS");
        naipPath = pathVal(properties, "naip-path");
        targetCrs = stringVal(properties, "target-crs");
        snapRaster = pathVal(properties, "snap-raster");
        resultsPath = pathVal(properties, "results-path");
        analysisYear = intVal(properties, "analysis-year");
        trustExistingOutputs = boolVal(properties, "trust-existing-outputs", true);
        mosaicPartialRegions = boolVal(properties, "mosaic-partial-regions", false);
        writeQuicklook = boolVal(properties, "write-quicklook", false);
        String seed = properties.getProperty("random-seed");
        randomSeed = (seed == null || seed.isBlank()) ? OptionalLong.empty()
              : OptionalLong.of(longVal(properties, "random-seed"));
    }

    public static Configuration load (Path propertiesFile) {
        Properties properties = new Properties();
        try (FileReader reader = new FileReader(propertiesFile.toFile())) {
            properties.load(reader);
        } catch (IOException e) {
            throw new RuntimeException("Could not read configuration file " + propertiesFile, e);
        }
        return new Configuration(properties, propertiesFile);
    }

    public static Configuration fromProperties (Properties properties) {
        return new Configuration(properties, null);
    }

    /// Read the same file again, producing a fresh instance. This one is left untouched.
    public Configuration reload () {
        if (source == null) {
            throw new IllegalStateException("Configuration was not loaded from a file and cannot be reloaded.");
        }
        return load(source);
    }

    private static String stringVal (Properties properties, String key) {
        String val = properties.getProperty(key);
        if (val == null || val.isBlank()) throw new RuntimeException("Missing configuration key: " + key);
        return val.strip();
    }

    private static String stringVal (Properties properties, String key, String defaultValue) {
        String val = properties.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        return val.strip();
    }

    private static Path pathVal (Properties properties, String key) {
        return Path.of(stringVal(properties, key));
    }

    private static int intVal (Properties properties, String key) {
        String val = stringVal(properties, key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    private static long longVal (Properties properties, String key) {
        String val = stringVal(properties, key);
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as long.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    private static boolean boolVal (Properties properties, String key, boolean defaultValue) {
        String val = properties.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        val = val.strip();
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new RuntimeException(message);
    }

}
