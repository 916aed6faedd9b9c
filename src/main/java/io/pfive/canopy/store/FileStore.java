// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/// Static methods for putting files into the results tree. Everything the pipeline produces is
/// first written in full to a temporary file next to its final location, then moved into place.
/// A file under its final name is therefore always complete, even if the process was killed while
/// writing it. The temporary file lives in the same directory so the move stays on one filesystem.
public abstract class FileStore {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    public static final String META_JSON_SUFFIX = ".meta.json";
    private static final String TEMP_SUFFIX = ".partial";

    // Object mapper adding module to handle Guava collection types.
    public static final ObjectMapper objectMapper = new ObjectMapper()
          .registerModule(new GuavaModule())
          .enable(SerializationFeature.INDENT_OUTPUT);

    /// Create a temporary file in the same directory as the given final path, creating that
    /// directory if needed. The main purpose of this method is to keep the checked exception out
    /// of every caller.
    public static Path tempFileBeside (Path finalPath) {
        try {
            Path dir = finalPath.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            return Files.createTempFile(dir, "." + finalPath.getFileName(), TEMP_SUFFIX);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /// Replace (or create) the file at finalPath with the fully written temporary file.
    public static void moveIntoPlace (Path tempPath, Path finalPath) {
        try {
            try {
                Files.move(tempPath, finalPath, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported, falling back to plain move for {}", finalPath);
                Files.move(tempPath, finalPath, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Could not move finished file into place: " + finalPath, e);
        }
    }

    /// Remove a leftover temporary file after a failed write. Never throws, as it is called while
    /// another exception is already propagating.
    public static void discard (Path tempPath) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file {}", tempPath, e);
        }
    }

    public static void writeJson (Object object, Path path) {
        Path temp = tempFileBeside(path);
        try {
            objectMapper.writeValue(temp.toFile(), object);
        } catch (IOException e) {
            discard(temp);
            throw new RuntimeException("Could not write JSON to " + path, e);
        }
        moveIntoPlace(temp, path);
    }

    public static void writeJsonTree (JsonNode tree, Path path) {
        writeJson(tree, path);
    }

    public static <T> T readJson (Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new RuntimeException("Could not read JSON from " + path, e);
        }
    }

    public static JsonNode readJsonTree (Path path) {
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new RuntimeException("Could not read JSON from " + path, e);
        }
    }

    /// Get the path of the JSON metadata sidecar for the given file.
    public static Path metadataPath (Path path) {
        return path.resolveSibling(path.getFileName() + META_JSON_SUFFIX);
    }

    public static void createDirectories (Path dir) {
        try {
            // Creates parent directories, no exception if directory already exists.
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

}
