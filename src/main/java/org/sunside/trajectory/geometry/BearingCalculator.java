package org.sunside.trajectory.geometry;

import lombok.experimental.UtilityClass;
import org.sunside.core.geo.GeoPoint;

import java.util.Objects;

/**
 * Initial great-circle bearing between two coordinates.
 */
@UtilityClass
public class BearingCalculator {

    /**
     * Heading assigned to the first sample of a trajectory, which has no predecessor (due east).
     */
    public static final double FIRST_SAMPLE_HEADING_DEG = 90.0d;

    /**
     * Computes the initial heading from {@code from} toward {@code to}.
     *
     * <p>0 is true north and angles grow clockwise. Identical points yield 0.</p>
     *
     * @return bearing in degrees, in {@code [0, 360)}.
     */
    public static double bearing(GeoPoint from, GeoPoint to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        double lat1Rad = from.latitudeRadians();
        double lat2Rad = to.latitudeRadians();
        double deltaLonRad = Math.toRadians(to.longitude() - from.longitude());

        double x = Math.sin(deltaLonRad) * Math.cos(lat2Rad);
        double y = Math.cos(lat1Rad) * Math.sin(lat2Rad)
                - Math.sin(lat1Rad) * Math.cos(lat2Rad) * Math.cos(deltaLonRad);
        return SphericalMath.normalizeDegrees(Math.toDegrees(Math.atan2(x, y)));
    }

    /**
     * Returns the heading of sample {@code index} given its predecessor.
     *
     * @param index sample index.
     * @param previous previous sample point, ignored for index 0.
     * @param current current sample point.
     * @return {@link #FIRST_SAMPLE_HEADING_DEG} for index 0, otherwise the leg bearing.
     */
    public static double headingAt(int index, GeoPoint previous, GeoPoint current) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        if (index == 0) {
            return FIRST_SAMPLE_HEADING_DEG;
        }
        return bearing(previous, current);
    }
}
