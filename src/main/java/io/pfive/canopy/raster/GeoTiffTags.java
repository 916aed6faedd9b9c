// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.raster;

import io.pfive.canopy.geo.Crs;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// The GeoTIFF tags placing an unrotated raster: the pixel scale, one tie point, and the EPSG code
/// from the GeoKey directory. Rasters located by a full ModelTransformation matrix are not handled
/// here and fall back to their world file.
final class GeoTiffTags {

    private static final int MODEL_TYPE_KEY = 1024;
    private static final int RASTER_TYPE_KEY = 1025;
    private static final int GEOGRAPHIC_TYPE_KEY = 2048;
    private static final int PROJECTED_TYPE_KEY = 3072;
    private static final int MODEL_TYPE_PROJECTED = 1;
    private static final int MODEL_TYPE_GEOGRAPHIC = 2;
    private static final int PIXEL_IS_AREA = 1;
    private static final int PIXEL_IS_POINT = 2;
    private static final int USER_DEFINED = 32767;

    final double xMin;
    final double yMax;
    final double cellWidth;
    final double cellHeight;
    /// Null when the file names no EPSG coordinate system.
    @Nullable
    final String crs;

    private GeoTiffTags (double xMin, double yMax, double cellWidth, double cellHeight, @Nullable String crs) {
        this.xMin = xMin;
        this.yMax = yMax;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
        this.crs = crs;
    }

    static Optional<GeoTiffTags> read (FileDirectory directory) {
        List<Double> scale = doubles(directory.get(FieldTagType.ModelPixelScale));
        List<Double> tiePoint = doubles(directory.get(FieldTagType.ModelTiepoint));
        if (scale.size() < 2 || tiePoint.size() < 6) return Optional.empty();
        Map<Integer, Integer> keys = geoKeys(directory.get(FieldTagType.GeoKeyDirectory));
        double cellWidth = scale.get(0);
        double cellHeight = scale.get(1);
        // The tie point joins raster position (I, J) to model position (X, Y).
        double xMin = tiePoint.get(3) - tiePoint.get(0) * cellWidth;
        double yMax = tiePoint.get(4) + tiePoint.get(1) * cellHeight;
        if (keys.getOrDefault(RASTER_TYPE_KEY, PIXEL_IS_AREA) == PIXEL_IS_POINT) {
            xMin -= cellWidth / 2;
            yMax += cellHeight / 2;
        }
        Integer code = keys.containsKey(PROJECTED_TYPE_KEY) ? keys.get(PROJECTED_TYPE_KEY) : keys.get(GEOGRAPHIC_TYPE_KEY);
        String crs = (code == null || code == USER_DEFINED) ? null : "EPSG:" + code;
        return Optional.of(new GeoTiffTags(xMin, yMax, cellWidth, cellHeight, crs));
    }

    GridSpec toGrid (String crs, int nCols, int nRows) {
        return new GridSpec(crs, xMin, yMax, cellWidth, cellHeight, nCols, nRows);
    }

    /// Add tags placing the top left corner of the raster, so other GIS tools can read it without
    /// the sidecar. The GeoKey directory is only written for EPSG coordinate systems.
    static void addTo (FileDirectory directory, GridSpec grid) {
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE, 3,
              List.of(grid.cellWidth(), grid.cellHeight(), 0.0)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE, 6,
              List.of(0.0, 0.0, 0.0, grid.xMin(), grid.yMax(), 0.0)));
        Integer code = epsgCode(grid.crs());
        if (code == null) return;
        boolean geographic = Crs.isGeographic(grid.crs());
        List<Integer> keys = List.of(
              1, 1, 0, 3,
              MODEL_TYPE_KEY, 0, 1, geographic ? MODEL_TYPE_GEOGRAPHIC : MODEL_TYPE_PROJECTED,
              RASTER_TYPE_KEY, 0, 1, PIXEL_IS_AREA,
              geographic ? GEOGRAPHIC_TYPE_KEY : PROJECTED_TYPE_KEY, 0, 1, code);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT, keys.size(), keys));
    }

    @Nullable
    private static Integer epsgCode (String crs) {
        String name = crs.toUpperCase(Locale.ROOT);
        if (!name.startsWith("EPSG:")) return null;
        try {
            int code = Integer.parseInt(name.substring(5));
            return (code > 0 && code < USER_DEFINED) ? code : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Double> doubles (@Nullable FileDirectoryEntry entry) {
        List<Double> values = new ArrayList<>();
        if (entry == null) return values;
        Object raw = entry.getValues();
        if (raw instanceof List<?> list) {
            for (Object value : list) values.add(((Number) value).doubleValue());
        } else if (raw instanceof Number number) {
            values.add(number.doubleValue());
        }
        return values;
    }

    /// GeoKeys whose value is held directly in the directory, by key id. The directory is a header
    /// of four shorts ending with the number of keys, then four shorts per key: id, location, count
    /// and value. A location of zero means the value is the short itself.
    private static Map<Integer, Integer> geoKeys (@Nullable FileDirectoryEntry entry) {
        List<Double> shorts = doubles(entry);
        Map<Integer, Integer> keys = new HashMap<>();
        if (shorts.size() < 4) return keys;
        int nKeys = shorts.get(3).intValue();
        for (int k = 0, i = 4; k < nKeys && i + 3 < shorts.size(); k++, i += 4) {
            if (shorts.get(i + 1).intValue() == 0 && shorts.get(i + 2).intValue() == 1) {
                keys.put(shorts.get(i).intValue(), shorts.get(i + 3).intValue());
            }
        }
        return keys;
    }

}
