// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import io.pfive.canopy.store.FileStore;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoTiffStoreTest {

    @TempDir
    Path tempDir;

    private final GeoTiffStore store = new GeoTiffStore();

    private static final String WORLD_FILE = "0.6\n0.0\n0.0\n-0.6\n500000.3\n1599999.7\n";

    private static GridRaster sample (Integer noData) {
        GridSpec grid = new GridSpec("EPSG:5070", 500_000, 1_600_000, 0.6, 0.6, 7, 5);
        GridRaster raster = GridRaster.create(grid, 2, noData);
        for (int row = 0; row < grid.nRows(); row++) {
            for (int col = 0; col < grid.nCols(); col++) {
                raster.set(0, row, col, row * 10 + col);
                raster.set(1, row, col, 255 - col);
            }
        }
        return raster;
    }

    @Test
    void writtenRasterReadsBackWithItsGeoreferencing () {
        Path path = tempDir.resolve("out").resolve("raster.tif");
        GridRaster raster = sample(3);
        store.write(raster, path, "unit test");
        assertTrue(store.exists(path));
        assertTrue(Files.exists(FileStore.metadataPath(path)));

        GridRaster read = store.read(path);
        assertEquals(raster.grid, read.grid);
        assertEquals(2, read.nBands());
        assertEquals(Integer.valueOf(3), read.noData);
        assertEquals(43, read.get(0, 4, 3));
        assertEquals(249, read.get(1, 4, 6));
        assertTrue(read.sameSamples(raster));
    }

    @Test
    void noTemporaryFilesAreLeftBehind () throws IOException {
        store.write(sample(null), tempDir.resolve("a.tif"), "unit test");
        store.write(sample(null), tempDir.resolve("a.tif"), "unit test again");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("a.tif", "a.tif.meta.json"), files.map(p -> p.getFileName().toString()).sorted().toList());
        }
        assertNull(store.read(tempDir.resolve("a.tif")).noData);
    }

    @Test
    void writtenRasterCarriesGeoTiffTags () throws IOException {
        Path path = tempDir.resolve("canopy_2014_Ozark_Highlands.tif");
        GridRaster raster = sample(null);
        new GeoTiffStore().write(raster, path, "unit test");
        Files.delete(FileStore.metadataPath(path));
        assertEquals(raster.grid, new GeoTiffStore().readGrid(path));

        Path geographic = tempDir.resolve("geographic.tif");
        GridSpec degrees = new GridSpec("EPSG:4326", -94.5, 36.5, 0.25, 0.25, 4, 2);
        store.write(GridRaster.create(degrees, 1, null), geographic, "unit test");
        Files.delete(FileStore.metadataPath(geographic));
        assertEquals(degrees, store.readGrid(geographic));
    }

    @Test
    void tagsWithoutCoordinateSystemTakeItFromTheName () {
        Path path = tempDir.resolve("m_3008601_ne_16_060_20181012.tif");
        writeUntaggedTiff(path, 7, 5,
              new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE, 3, List.of(0.6, 0.6, 0.0)),
              new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE, 6,
                    List.of(2.0, 1.0, 0.0, 500_001.2, 1_599_999.4, 0.0)));
        GridSpec grid = store.readGrid(path);
        assertEquals("EPSG:26916", grid.crs());
        assertEquals(500_000, grid.xMin(), 1e-6);
        assertEquals(1_600_000, grid.yMax(), 1e-6);
        assertEquals(7, grid.nCols());
    }

    @Test
    void imageryWithoutSidecarUsesWorldFileAndTileName () throws IOException {
        Path path = tempDir.resolve("m_3608906_ne_15_060_20140527.tif");
        writeUntaggedTiff(path, 7, 5);
        // Center of the top left cell, as world files give it.
        Files.writeString(GeoTiffStore.worldFilePath(path), WORLD_FILE);

        GridSpec grid = store.readGrid(path);
        assertEquals("EPSG:26915", grid.crs());
        assertEquals(500_000, grid.xMin(), 1e-6);
        assertEquals(1_600_000, grid.yMax(), 1e-6);
        assertEquals(0.6, grid.cellWidth(), 1e-9);
        assertEquals(7, grid.nCols());
        assertEquals(5, grid.nRows());
        assertNull(store.read(path).noData);
    }

    @Test
    void stagedRasterWithWorldFileIsInTheStagingCoordinateSystem () throws IOException {
        Path path = tempDir.resolve("rm_3608906_ne_15_060_20140527.tif");
        writeUntaggedTiff(path, 7, 5);
        Files.writeString(GeoTiffStore.worldFilePath(path), WORLD_FILE);
        assertEquals("EPSG:5070", new GeoTiffStore("epsg:5070").readGrid(path).crs());
        assertThrows(RasterException.class, () -> new GeoTiffStore().readGrid(path));
    }

    @Test
    void rasterWithoutGeoreferencingIsRejected () {
        Path path = tempDir.resolve("plain.tif");
        writeUntaggedTiff(path, 7, 5);
        assertThrows(RasterException.class, () -> store.readGrid(path));
    }

    /// A single band TIFF as other tools write it, with only the given extra tags.
    private static void writeUntaggedTiff (Path path, int width, int height, FileDirectoryEntry... entries) {
        Rasters rasters = new Rasters(width, height, 1, FieldType.SSHORT);
        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(16);
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_SIGNED_INT);
        for (FileDirectoryEntry entry : entries) directory.addEntry(entry);
        directory.setWriteRasters(rasters);
        TIFFImage image = new TIFFImage();
        image.add(directory);
        try {
            TiffWriter.writeTiff(path.toFile(), image);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
