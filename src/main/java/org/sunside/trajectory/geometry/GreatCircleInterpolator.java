package org.sunside.trajectory.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sunside.core.geo.GeoPoint;
import org.sunside.trajectory.AmbiguousRouteException;
import org.sunside.trajectory.InsufficientSamplesException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Spherical linear interpolation along the minor great-circle arc between two points.
 *
 * <p>The returned sequence always has {@code steps + 1} entries; the first entry is the
 * origin and the last is the destination, both returned as the exact input instances.
 * Coincident endpoints yield {@code steps + 1} copies of the origin. Antipodal endpoints
 * are rejected because every meridian-like great circle through them is equally short.</p>
 */
public final class GreatCircleInterpolator {
    public static final double DEFAULT_COINCIDENT_TOLERANCE_RADIANS = 1e-12d;
    public static final double DEFAULT_ANTIPODAL_TOLERANCE_RADIANS = 1e-9d;

    private static final Logger log = LoggerFactory.getLogger(GreatCircleInterpolator.class);

    private final double coincidentToleranceRadians;
    private final double antipodalToleranceRadians;

    /**
     * Creates an interpolator with default degenerate-case tolerances.
     */
    public GreatCircleInterpolator() {
        this(DEFAULT_COINCIDENT_TOLERANCE_RADIANS, DEFAULT_ANTIPODAL_TOLERANCE_RADIANS);
    }

    /**
     * Creates an interpolator with explicit degenerate-case tolerances.
     *
     * @param coincidentToleranceRadians central angle at or below which endpoints are treated as identical.
     * @param antipodalToleranceRadians distance from {@code PI} at or below which endpoints are antipodal.
     */
    public GreatCircleInterpolator(double coincidentToleranceRadians, double antipodalToleranceRadians) {
        this.coincidentToleranceRadians = requireTolerance(coincidentToleranceRadians, "coincidentToleranceRadians");
        this.antipodalToleranceRadians = requireTolerance(antipodalToleranceRadians, "antipodalToleranceRadians");
    }

    /**
     * Interpolates {@code steps + 1} points from {@code from} to {@code to}.
     *
     * @param from route origin.
     * @param to route destination.
     * @param steps number of equal angular segments, at least 1.
     * @return immutable ordered point sequence.
     * @throws InsufficientSamplesException when {@code steps < 1}.
     * @throws AmbiguousRouteException when the endpoints are antipodal.
     */
    public List<GeoPoint> interpolate(GeoPoint from, GeoPoint to, int steps) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (steps < 1) {
            throw new InsufficientSamplesException("steps must be >= 1, got " + steps);
        }

        double centralAngle = SphericalMath.centralAngleRadians(from, to);
        if (centralAngle <= coincidentToleranceRadians) {
            log.debug("Coincident endpoints {} and {}; returning {} copies", from, to, steps + 1);
            return Collections.nCopies(steps + 1, from);
        }
        if (Math.PI - centralAngle <= antipodalToleranceRadians) {
            throw new AmbiguousRouteException(
                    "great-circle route between antipodal endpoints " + from + " and " + to + " is undefined"
            );
        }

        double[] start = SphericalMath.toUnitVector(from);
        double[] end = SphericalMath.toUnitVector(to);
        double sinCentralAngle = Math.sin(centralAngle);

        List<GeoPoint> points = new ArrayList<>(steps + 1);
        points.add(from);
        for (int i = 1; i < steps; i++) {
            double fraction = (double) i / steps;
            double a = Math.sin((1.0d - fraction) * centralAngle) / sinCentralAngle;
            double b = Math.sin(fraction * centralAngle) / sinCentralAngle;
            points.add(SphericalMath.fromVector(
                    a * start[0] + b * end[0],
                    a * start[1] + b * end[1],
                    a * start[2] + b * end[2]
            ));
        }
        points.add(to);
        return Collections.unmodifiableList(points);
    }

    private static double requireTolerance(double tolerance, String fieldName) {
        if (!Double.isFinite(tolerance) || tolerance < 0.0d) {
            throw new IllegalArgumentException(fieldName + " must be finite and >= 0, got " + tolerance);
        }
        return tolerance;
    }
}
