package org.sunside.trajectory.solar;

import org.sunside.core.geo.GeoPoint;

import java.time.Instant;

/**
 * External capability computing the sun's altitude and azimuth.
 *
 * <p>Implementations must be safe for concurrent calls when used with a parallel
 * trajectory builder. Failures may be reported as
 * {@link org.sunside.trajectory.SolarProviderException} or any other runtime exception.</p>
 */
@FunctionalInterface
public interface SolarPositionProvider {

    /**
     * Returns the sun position at {@code point} and {@code instant}.
     *
     * @param point observer coordinate.
     * @param instant UTC instant.
     * @return altitude in degrees and azimuth in {@code [0, 360)}.
     */
    SolarPosition position(GeoPoint point, Instant instant);
}
