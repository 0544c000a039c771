package org.sunside.trajectory.temporal;

import org.sunside.core.geo.GeoPoint;

import java.util.Optional;

/**
 * External capability resolving the IANA time-zone identifier in effect at a coordinate.
 *
 * <p>Implementations own any remote lookup, credentials, caching, and retry policy.</p>
 */
@FunctionalInterface
public interface TimeZoneResolver {

    /**
     * Resolves the zone id for one coordinate.
     *
     * @param point coordinate to resolve.
     * @return zone id such as {@code Europe/Istanbul}, or empty when no zone is known.
     */
    Optional<String> zoneFor(GeoPoint point);
}
