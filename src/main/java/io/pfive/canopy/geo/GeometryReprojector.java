// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.geo;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.ProjCoordinate;

/// Transforms JTS geometries and single points from one coordinate system to another. Create one
/// instance and reuse it for every geometry with the same source and target. When source and
/// target are the same, geometries are returned untouched.
public class GeometryReprojector {

    public final String sourceCrs;
    public final String targetCrs;

    // Null when no transformation is needed.
    private final CoordinateTransform transform;

    // Reused scratch coordinates, so not threadsafe.
    private final ProjCoordinate in = new ProjCoordinate();
    private final ProjCoordinate out = new ProjCoordinate();

    public GeometryReprojector (String sourceCrs, String targetCrs) {
        this.sourceCrs = Crs.normalize(sourceCrs);
        this.targetCrs = Crs.normalize(targetCrs);
        this.transform = this.sourceCrs.equals(this.targetCrs) ? null : Crs.transform(sourceCrs, targetCrs);
    }

    public boolean isIdentity () {
        return transform == null;
    }

    /// Returns a transformed copy of the geometry. The input geometry is not modified.
    public Geometry reproject (Geometry geometry) {
        if (transform == null) return geometry;
        Geometry copy = geometry.copy();
        copy.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter (CoordinateSequence seq, int i) {
                in.x = seq.getX(i);
                in.y = seq.getY(i);
                transform.transform(in, out);
                seq.setOrdinate(i, CoordinateSequence.X, out.x);
                seq.setOrdinate(i, CoordinateSequence.Y, out.y);
            }

            @Override
            public boolean isDone () {
                return false;
            }

            @Override
            public boolean isGeometryChanged () {
                return true;
            }
        });
        return copy;
    }

    /// Transform a single point, returning {x, y}.
    public double[] reproject (double x, double y) {
        if (transform == null) return new double[] {x, y};
        in.x = x;
        in.y = y;
        transform.transform(in, out);
        return new double[] {out.x, out.y};
    }

    /// Return an envelope in the target system that contains the given source envelope. Edges are
    /// densified because straight lines in one projection are curves in another.
    public Envelope reproject (Envelope source) {
        if (transform == null) return new Envelope(source);
        final int steps = 16;
        Envelope result = new Envelope();
        for (int i = 0; i <= steps; i++) {
            double fx = source.getMinX() + source.getWidth() * i / steps;
            double fy = source.getMinY() + source.getHeight() * i / steps;
            expand(result, fx, source.getMinY());
            expand(result, fx, source.getMaxY());
            expand(result, source.getMinX(), fy);
            expand(result, source.getMaxX(), fy);
        }
        return result;
    }

    private void expand (Envelope envelope, double x, double y) {
        double[] xy = reproject(x, y);
        envelope.expandToInclude(xy[0], xy[1]);
    }

}
