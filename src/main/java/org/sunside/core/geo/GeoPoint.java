package org.sunside.core.geo;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Immutable geodetic coordinate in decimal degrees.
 *
 * <p>Latitude is bounded to {@code [-90, 90]} and longitude to {@code [-180, 180]}.
 * Both must be finite.</p>
 */
@Value
@Accessors(fluent = true)
public class GeoPoint {
    public static final double MIN_LATITUDE = -90.0d;
    public static final double MAX_LATITUDE = 90.0d;
    public static final double MIN_LONGITUDE = -180.0d;
    public static final double MAX_LONGITUDE = 180.0d;

    /** Latitude in degrees, positive north. */
    double latitude;
    /** Longitude in degrees, positive east. */
    double longitude;

    private GeoPoint(double latitude, double longitude) {
        validate(latitude, longitude);
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Creates a validated coordinate.
     *
     * @param latitude latitude in degrees.
     * @param longitude longitude in degrees.
     * @return coordinate value.
     * @throws IllegalArgumentException when either component is non-finite or out of range.
     */
    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Returns latitude in radians.
     */
    public double latitudeRadians() {
        return Math.toRadians(latitude);
    }

    /**
     * Returns longitude in radians.
     */
    public double longitudeRadians() {
        return Math.toRadians(longitude);
    }

    private static void validate(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException(
                    "coordinates must be finite: (" + latitude + ", " + longitude + ")"
            );
        }
        if (latitude < MIN_LATITUDE || latitude > MAX_LATITUDE) {
            throw new IllegalArgumentException("latitude out of range [-90, 90]: " + latitude);
        }
        if (longitude < MIN_LONGITUDE || longitude > MAX_LONGITUDE) {
            throw new IllegalArgumentException("longitude out of range [-180, 180]: " + longitude);
        }
    }
}
