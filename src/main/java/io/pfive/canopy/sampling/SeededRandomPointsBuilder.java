// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.sampling;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.shape.random.RandomPointsBuilder;

import java.util.Random;

/// JTS RandomPointsBuilder draws from Math.random(), so its points cannot be reproduced. This draws
/// from a supplied Random instead, which makes point sets repeatable for a given seed.
public class SeededRandomPointsBuilder extends RandomPointsBuilder {

    private final Random random;

    public SeededRandomPointsBuilder (GeometryFactory geometryFactory, Random random) {
        super(geometryFactory);
        this.random = random;
    }

    @Override
    protected Coordinate createRandomCoord (Envelope env) {
        double x = env.getMinX() + env.getWidth() * random.nextDouble();
        double y = env.getMinY() + env.getHeight() * random.nextDouble();
        return createCoord(x, y);
    }

}
