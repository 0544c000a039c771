package org.sunside.trajectory.geometry;

import lombok.experimental.UtilityClass;
import org.sunside.core.geo.GeoPoint;

/**
 * Numeric helpers for unit-sphere geometry.
 */
@UtilityClass
public class SphericalMath {
    private static final double FULL_TURN_DEGREES = 360.0d;

    /**
     * Computes the central angle between two points from their unit vectors.
     *
     * @return angular separation in radians, in {@code [0, PI]}.
     */
    public static double centralAngleRadians(GeoPoint from, GeoPoint to) {
        return angleBetween(toUnitVector(from), toUnitVector(to));
    }

    /**
     * Normalizes any finite angle into {@code [0, 360)}.
     */
    public static double normalizeDegrees(double degrees) {
        double normalized = degrees % FULL_TURN_DEGREES;
        if (normalized < 0.0d) {
            normalized += FULL_TURN_DEGREES;
        }
        // -1e-17 % 360 + 360 rounds to exactly 360.
        if (normalized >= FULL_TURN_DEGREES) {
            return 0.0d;
        }
        return normalized;
    }

    /**
     * Converts a coordinate into an earth-centered unit vector {@code [x, y, z]}.
     */
    static double[] toUnitVector(GeoPoint point) {
        double latRad = point.latitudeRadians();
        double lonRad = point.longitudeRadians();
        double cosLat = Math.cos(latRad);
        return new double[]{
                cosLat * Math.cos(lonRad),
                cosLat * Math.sin(lonRad),
                Math.sin(latRad)
        };
    }

    /**
     * Angle between two unit vectors as {@code atan2(|a x b|, a . b)}.
     *
     * <p>Keeps full precision near both 0 and {@code PI}, where haversine and
     * {@code acos} lose most of their digits.</p>
     *
     * @return angle in radians, in {@code [0, PI]}.
     */
    static double angleBetween(double[] a, double[] b) {
        double crossX = a[1] * b[2] - a[2] * b[1];
        double crossY = a[2] * b[0] - a[0] * b[2];
        double crossZ = a[0] * b[1] - a[1] * b[0];
        double dot = a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
        return Math.atan2(Math.sqrt(crossX * crossX + crossY * crossY + crossZ * crossZ), dot);
    }

    /**
     * Converts an earth-centered vector back into a coordinate.
     *
     * <p>The vector need not be unit length; only its direction is used.</p>
     */
    static GeoPoint fromVector(double x, double y, double z) {
        double latDeg = Math.toDegrees(Math.atan2(z, Math.hypot(x, y)));
        double lonDeg = Math.toDegrees(Math.atan2(y, x));
        return GeoPoint.of(
                clamp(latDeg, GeoPoint.MIN_LATITUDE, GeoPoint.MAX_LATITUDE),
                clamp(lonDeg, GeoPoint.MIN_LONGITUDE, GeoPoint.MAX_LONGITUDE)
        );
    }

    /**
     * Clamps a value into inclusive {@code [min, max]} bounds.
     */
    static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
