// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import io.pfive.canopy.geo.Crs;
import io.pfive.canopy.membership.NaipTileName;
import io.pfive.canopy.store.FileStore;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/// Stores rasters as 16-bit GeoTIFF files, with georeferencing and the no-data value also kept in
/// a `.meta.json` sidecar. Georeferencing is read from the sidecar when there is one, then from the
/// GeoTIFF tags, and finally from an ESRI world file (`.tfw`) next to the TIFF. Imagery delivered by
/// USDA may carry only a world file. Its coordinate system is then the UTM zone in the tile's file
/// name, while any other raster is taken to be in the staging coordinate system.
///
/// Writes go to temporary files that are moved into place sidecar first, so a TIFF under its final
/// name always has its georeferencing beside it.
public class GeoTiffStore implements RasterStore {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String WORLD_FILE_EXTENSION = ".tfw";

    @Nullable
    private final String stagingCrs;

    /// A store that can only place world-file rasters named like NAIP imagery.
    public GeoTiffStore () {
        this(null);
    }

    public GeoTiffStore (@Nullable String stagingCrs) {
        this.stagingCrs = stagingCrs == null ? null : Crs.normalize(stagingCrs);
    }

    @Override
    public GridRaster read (Path path) {
        GridSpec grid = readGrid(path);
        Rasters rasters = readRasters(path);
        if (rasters.getWidth() != grid.nCols() || rasters.getHeight() != grid.nRows()) {
            throw new RasterException(String.format("Raster %s is %dx%d but its georeferencing describes %dx%d.",
                  path, rasters.getWidth(), rasters.getHeight(), grid.nCols(), grid.nRows()));
        }
        int nBands = rasters.getSamplesPerPixel();
        short[][] bands = new short[nBands][grid.nCells()];
        for (int row = 0; row < grid.nRows(); row++) {
            for (int col = 0; col < grid.nCols(); col++) {
                int i = grid.flatIndex(row, col);
                for (int b = 0; b < nBands; b++) {
                    bands[b][i] = rasters.getPixelSample(b, col, row).shortValue();
                }
            }
        }
        return new GridRaster(grid, bands, readNoData(path));
    }

    @Override
    public GridSpec readGrid (Path path) {
        Path metadataPath = FileStore.metadataPath(path);
        if (Files.exists(metadataPath)) {
            return FileStore.readJson(metadataPath, RasterMetadata.class).gridSpec();
        }
        FileDirectory directory = readDirectory(path);
        int nCols = directory.getImageWidth().intValue();
        int nRows = directory.getImageHeight().intValue();
        Optional<GeoTiffTags> tags = GeoTiffTags.read(directory);
        if (tags.isPresent()) {
            String crs = tags.get().crs != null ? tags.get().crs : crsFromName(path);
            return tags.get().toGrid(crs, nCols, nRows);
        }
        Path worldFile = worldFilePath(path);
        if (Files.exists(worldFile)) {
            return readWorldFile(path, worldFile, nCols, nRows);
        }
        throw new RasterException("No georeferencing found for raster " + path);
    }

    @Override
    public void write (GridRaster raster, Path path, String source) {
        GridSpec grid = raster.grid;
        int nBands = raster.nBands();
        Rasters rasters = new Rasters(grid.nCols(), grid.nRows(), nBands, FieldType.SSHORT);
        for (int row = 0; row < grid.nRows(); row++) {
            for (int col = 0; col < grid.nCols(); col++) {
                for (int b = 0; b < nBands; b++) {
                    rasters.setPixelSample(b, col, row, (short) raster.get(b, row, col));
                }
            }
        }
        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(grid.nCols());
        directory.setImageHeight(grid.nRows());
        directory.setBitsPerSample(new ArrayList<>(Collections.nCopies(nBands, 16)));
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(nBands);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(new ArrayList<>(Collections.nCopies(nBands, TiffConstants.SAMPLE_FORMAT_SIGNED_INT)));
        GeoTiffTags.addTo(directory, grid);
        directory.setWriteRasters(rasters);
        TIFFImage image = new TIFFImage();
        image.add(directory);

        Path tiffTemp = FileStore.tempFileBeside(path);
        try {
            TiffWriter.writeTiff(tiffTemp.toFile(), image);
        } catch (IOException | TiffException e) {
            FileStore.discard(tiffTemp);
            throw new RasterException("Could not write raster " + path, e);
        }
        FileStore.writeJson(RasterMetadata.forRaster(raster, source), FileStore.metadataPath(path));
        FileStore.moveIntoPlace(tiffTemp, path);
        LOG.debug("Wrote {}x{} raster {}", grid.nCols(), grid.nRows(), path);
    }

    @Override
    public boolean exists (Path path) {
        return Files.exists(path);
    }

    private static FileDirectory readDirectory (Path path) {
        try {
            TIFFImage image = TiffReader.readTiff(path.toFile());
            return image.getFileDirectory();
        } catch (IOException | TiffException e) {
            throw new RasterException("Could not read raster " + path, e);
        }
    }

    private static Rasters readRasters (Path path) {
        try {
            return TiffReader.readTiff(path.toFile()).getFileDirectory().readRasters();
        } catch (IOException | TiffException e) {
            throw new RasterException("Could not read raster " + path, e);
        }
    }

    private static Integer readNoData (Path path) {
        Path metadataPath = FileStore.metadataPath(path);
        if (!Files.exists(metadataPath)) return null;
        return FileStore.readJson(metadataPath, RasterMetadata.class).noData;
    }

    static Path worldFilePath (Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        return path.resolveSibling(base + WORLD_FILE_EXTENSION);
    }

    /// Source imagery is delivered in the UTM zone its name gives. Anything else without its own
    /// coordinate system was written by the pipeline, in the staging coordinate system.
    private String crsFromName (Path path) {
        String name = path.getFileName().toString();
        Optional<String> utm = NaipTileName.tryParse(name).map(NaipTileName::utmCrs);
        if (utm.isPresent()) return utm.get();
        if (stagingCrs != null) return stagingCrs;
        throw new RasterException("Cannot determine coordinate system of " + path
              + ": it names no UTM zone and no staging coordinate system is configured.");
    }

    /// A world file holds six lines: x cell size, two rotation terms, negative y cell size, and the
    /// coordinates of the center of the top left cell.
    private GridSpec readWorldFile (Path path, Path worldFile, int nCols, int nRows) {
        List<Double> terms = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(worldFile, StandardCharsets.US_ASCII)) {
                if (!line.isBlank()) terms.add(Double.parseDouble(line.strip()));
            }
        } catch (IOException | NumberFormatException e) {
            throw new RasterException("Could not read world file " + worldFile, e);
        }
        if (terms.size() != 6) {
            throw new RasterException("World file should contain six values: " + worldFile);
        }
        if (terms.get(1) != 0 || terms.get(2) != 0) {
            throw new RasterException("Rotated rasters are not supported: " + worldFile);
        }
        String crs = crsFromName(path);
        double cellWidth = terms.get(0);
        double cellHeight = -terms.get(3);
        double xMin = terms.get(4) - cellWidth / 2;
        double yMax = terms.get(5) + cellHeight / 2;
        return new GridSpec(crs, xMin, yMax, cellWidth, cellHeight, nCols, nRows);
    }

}
