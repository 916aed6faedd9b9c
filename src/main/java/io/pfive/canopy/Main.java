// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy;

import com.google.common.base.Stopwatch;
import io.pfive.canopy.background.StageReport;
import io.pfive.canopy.membership.RegionSet;
import io.pfive.canopy.membership.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/// Runs one pipeline command from the command line:
///
///     Main <conf.properties> <command> [arguments]
///
/// Region ids are given as one comma separated argument, such as 3,7,12. The exit status is 1 if
/// the command could not run at all and 2 if it ran but some items were missing, so batch scripts
/// can tell when a stage needs to be run again.
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String USAGE = String.join("\n",
          "Usage: Main <conf.properties> <command> [arguments]",
          "  assign-regions",
          "  select-tiles <ids>",
          "  reproject <ids>",
          "  convert <ids>",
          "  clip <ids>",
          "  mosaic <ids>",
          "  pipeline <ids>",
          "  correct-inverted <ids>",
          "  vectorize <ids>",
          "  generate-points <ids> <min-area> <max-area> <min-points> <max-points>",
          "  update-points <old-results-path> <old-year> <ids> <inverted-ids>",
          "  tiles-for-points <points.geojson>");

    public static void main (String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            System.exit(1);
        }
        // Relative paths in the configuration file are resolved against the current directory.
        Path currentDir = FileSystems.getDefault().getPath("").toAbsolutePath();
        LOG.info("Current working directory is: {}", currentDir);
        Configuration config = Configuration.load(Path.of(args[0]));
        String command = args[1];
        String[] commandArgs = Arrays.copyOfRange(args, 2, args.length);
        Stopwatch stopwatch = Stopwatch.createStarted();
        int status;
        try {
            status = run(new CanopyPipeline(config), command, commandArgs);
        } catch (IllegalArgumentException e) {
            LOG.error("{}", e.getMessage());
            System.err.println(USAGE);
            status = 1;
        }
        LOG.info("Command {} finished in {}", command, stopwatch);
        System.exit(status);
    }

    /// Run one command, returning the process exit status.
    static int run (CanopyPipeline pipeline, String command, String[] args) {
        switch (command) {
            case "assign-regions" -> {
                expectArgs(command, args, 0);
                int n = pipeline.assignRegions();
                LOG.info("{} tiles are in at least one region.", n);
                return 0;
            }
            case "select-tiles" -> {
                expectArgs(command, args, 1);
                List<Tile> tiles = pipeline.selectTiles(ids(args[0]));
                tiles.forEach(tile -> LOG.info("  {}", tile));
                LOG.info("{} tiles selected.", tiles.size());
                return 0;
            }
            case "reproject" -> {
                expectArgs(command, args, 1);
                return exitStatus(List.of(pipeline.reproject(ids(args[0]))));
            }
            case "convert" -> {
                expectArgs(command, args, 1);
                return exitStatus(List.of(pipeline.convert(ids(args[0]))));
            }
            case "clip" -> {
                expectArgs(command, args, 1);
                return exitStatus(List.of(pipeline.clip(ids(args[0]))));
            }
            case "mosaic" -> {
                expectArgs(command, args, 1);
                return exitStatus(List.of(pipeline.mosaic(ids(args[0]))));
            }
            case "pipeline" -> {
                expectArgs(command, args, 1);
                return exitStatus(pipeline.pipeline(ids(args[0])));
            }
            case "correct-inverted" -> {
                expectArgs(command, args, 1);
                return exitStatus(List.of(pipeline.correctInverted(ids(args[0]))));
            }
            case "vectorize" -> {
                expectArgs(command, args, 1);
                return exitStatus(List.of(pipeline.vectorize(ids(args[0]))));
            }
            case "generate-points" -> {
                expectArgs(command, args, 5);
                return exitStatus(List.of(pipeline.generatePoints(ids(args[0]),
                      parseDouble(args[1]), parseDouble(args[2]), parseInt(args[3]), parseInt(args[4]))));
            }
            case "update-points" -> {
                expectArgs(command, args, 4);
                return exitStatus(List.of(pipeline.updatePoints(Path.of(args[0]), parseInt(args[1]),
                      ids(args[2]), ids(args[3]))));
            }
            case "tiles-for-points" -> {
                expectArgs(command, args, 1);
                pipeline.tilesForPoints(Path.of(args[0]));
                return 0;
            }
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static int exitStatus (List<StageReport> reports) {
        for (StageReport report : reports) {
            if (!report.missingItems().isEmpty()) return 2;
        }
        return 0;
    }

    private static void expectArgs (String command, String[] args, int n) {
        if (args.length != n) {
            var message = String.format("Command %s takes %d arguments but %d were given.", command, n, args.length);
            throw new IllegalArgumentException(message);
        }
    }

    private static RegionSet ids (String arg) {
        RegionSet ids = RegionSet.parse(arg);
        if (ids.isEmpty()) throw new IllegalArgumentException("No region ids in '" + arg + "'");
        return ids;
    }

    private static double parseDouble (String arg) {
        try {
            return Double.parseDouble(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse '" + arg + "' as a number.", e);
        }
    }

    private static int parseInt (String arg) {
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse '" + arg + "' as an integer.", e);
        }
    }

}
