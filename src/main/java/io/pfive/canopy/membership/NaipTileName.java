// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.membership;

import io.pfive.canopy.geo.Crs;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// The parts of a NAIP quarter-quadrangle file name, for example
/// `m_3608906_ne_15_060_20140527_20141022.tif`: a five digit 1-degree block and two digit
/// 7.5-minute quadrangle within it, the quarter of that quadrangle, the UTM zone, the resolution
/// code, the acquisition date, and in the tile index layer a trailing publication date.
/// The imagery file on disk carries only the acquisition date, and lives in a folder named after
/// the five digit block. The stem is kept exactly as written, since it names a file on disk.
public record NaipTileName (String stem, String prefix, String quad, String cell, String quadrant,
                            int utmZone, String resolution, String acquisitionDate) {

    private static final Pattern PATTERN = Pattern.compile(
          "(([a-z])_(\\d{5})(\\d{2})_(ne|nw|se|sw)_(\\d{1,2})_(\\d+)_(\\d{8}))(?:_\\d{8})?(?:\\.tif)?",
          Pattern.CASE_INSENSITIVE);

    public static NaipTileName parse (String fileName) {
        return tryParse(fileName).orElseThrow(() ->
              new IllegalArgumentException("Not a NAIP quarter quadrangle file name: " + fileName));
    }

    /// Empty for anything that is not a source imagery name, including null and the stage
    /// prefixed names derived from one, like `rm_3608906_ne_15_060_20140527.tif`.
    public static Optional<NaipTileName> tryParse (String fileName) {
        if (fileName == null) return Optional.empty();
        Matcher m = PATTERN.matcher(fileName.strip());
        if (!m.matches()) return Optional.empty();
        return Optional.of(new NaipTileName(
              m.group(1),
              m.group(2).toLowerCase(Locale.ROOT),
              m.group(3),
              m.group(4),
              m.group(5).toLowerCase(Locale.ROOT),
              Integer.parseInt(m.group(6)),
              m.group(7),
              m.group(8)
        ));
    }

    /// Name of the folder under the imagery root holding this tile.
    public String quadFolder () {
        return quad;
    }

    /// The imagery file name, without the publication date the tile index adds.
    public String sourceFileName () {
        return stem + ".tif";
    }

    /// Coordinate system the imagery is delivered in.
    public String utmCrs () {
        return Crs.nad83Utm(utmZone);
    }

}
