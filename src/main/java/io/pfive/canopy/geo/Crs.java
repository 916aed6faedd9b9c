// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.geo;

import com.google.common.base.Preconditions;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.proj.LongLatProjection;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/// Coordinate reference systems are identified throughout by their authority name, like
/// "EPSG:5070". Files and layers carry these names, and the proj4j objects are looked up here only
/// when coordinates actually need to be transformed. Building a CRS means parsing the EPSG
/// database, so they are cached. Not threadsafe: the pipeline is single threaded.
public abstract class Crs {

    private static final CRSFactory crsFactory = new CRSFactory();
    private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private static final Map<String, CoordinateReferenceSystem> cache = new HashMap<>();

    public static String normalize (String name) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "CRS name must be supplied.");
        return name.strip().toUpperCase(Locale.ROOT);
    }

    public static boolean same (String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    public static CoordinateReferenceSystem forName (String name) {
        return cache.computeIfAbsent(normalize(name), crsFactory::createFromName);
    }

    public static CoordinateTransform transform (String from, String to) {
        return transformFactory.createTransform(forName(from), forName(to));
    }

    /// True for latitude and longitude systems, whose units are degrees rather than meters.
    public static boolean isGeographic (String name) {
        return forName(name).getProjection() instanceof LongLatProjection;
    }

    /// USDA imagery is delivered in UTM zones on the NAD83 datum, EPSG codes 26901 through 26923.
    public static String nad83Utm (int zone) {
        Preconditions.checkArgument(zone >= 1 && zone <= 23, "No NAD83 UTM zone %s", zone);
        return String.format("EPSG:269%02d", zone);
    }

}
