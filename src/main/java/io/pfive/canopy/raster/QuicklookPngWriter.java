// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import ar.com.hjg.pngj.FilterType;
import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineHelper;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;
import ar.com.hjg.pngj.chunks.PngChunkTextVar;
import io.pfive.canopy.store.FileStore;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Writes a classification raster as an RGB PNG for a quick visual check: canopy dark green,
/// non-canopy pale tan, no-data white. The grid's corners and coordinate system are added as tEXt
/// chunks so the image can be placed on a map by hand.
public abstract class QuicklookPngWriter {

    private static final int CANOPY_RGB = 0x1E6B2E;
    private static final int NON_CANOPY_RGB = 0xE8E0C4;
    private static final int NO_DATA_RGB = 0xFFFFFF;
    private static final int OTHER_RGB = 0xD02020;

    public static void write (GridRaster raster, Path path) {
        Path temp = FileStore.tempFileBeside(path);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
            streamPng(raster, out);
        } catch (IOException e) {
            FileStore.discard(temp);
            throw new RasterException("Could not write PNG " + path, e);
        }
        FileStore.moveIntoPlace(temp, path);
    }

    /// The PNGJ library appears to reverse the meaning of iTXt language tag and translated key.
    /// This asks for uncompressed Latin1, which creates simpler tEXt chunks instead of iTXt.
    private static void addSimpleTextTag (PngWriter png, String key, String value) {
        png.getMetadata().setText(key, value, true, false);
    }

    /// Closes the stream when done.
    public static void streamPng (GridRaster raster, OutputStream outputStream) {
        GridSpec grid = raster.grid;
        // Image will be 8 bits per channel with no alpha.
        ImageInfo imi = new ImageInfo(grid.nCols(), grid.nRows(), 8, false);
        PngWriter png = new PngWriter(outputStream, imi);
        png.setFilterType(FilterType.FILTER_ADAPTIVE_FAST);
        png.setCompLevel(4);
        addSimpleTextTag(png, PngChunkTextVar.KEY_Title, "Canopy quicklook");
        addSimpleTextTag(png, "CRS", grid.crs());
        addSimpleTextTag(png, "minX", Double.toString(grid.xMin()));
        addSimpleTextTag(png, "minY", Double.toString(grid.yMin()));
        addSimpleTextTag(png, "maxX", Double.toString(grid.xMax()));
        addSimpleTextTag(png, "maxY", Double.toString(grid.yMax()));
        // Image line object can be reused for successive rows. Raster rows are already top down.
        ImageLineInt iline = new ImageLineInt(imi);
        for (int row = 0; row < grid.nRows(); row++) {
            for (int col = 0; col < grid.nCols(); col++) {
                ImageLineHelper.setPixelRGB8(iline, col, colorFor(raster, raster.get(row, col)));
            }
            png.writeRow(iline);
        }
        // This call closes the OutputStream wrapped by the PngWriter.
        png.end();
    }

    private static int colorFor (GridRaster raster, int value) {
        if (raster.isNoData(value)) return NO_DATA_RGB;
        if (value == ClassCodes.CANOPY) return CANOPY_RGB;
        if (value == ClassCodes.NON_CANOPY) return NON_CANOPY_RGB;
        return OTHER_RGB;
    }

}
