package org.sunside.trajectory.core;

import lombok.Builder;
import lombok.Value;
import org.sunside.core.geo.GeoPoint;

import java.time.LocalDateTime;

/**
 * One travel segment expressed in local wall-clock times with explicit zone ids.
 */
@Value
@Builder(toBuilder = true)
public class TrajectoryRequest {
    /** Route origin. */
    GeoPoint departurePoint;
    /** Route destination. */
    GeoPoint arrivalPoint;
    /** Departure wall-clock time at the origin. */
    LocalDateTime departureLocalTime;
    /** Arrival wall-clock time at the destination. */
    LocalDateTime arrivalLocalTime;
    /** Zone id of the origin, for example {@code Europe/Istanbul}. */
    String departureZoneId;
    /** Zone id of the destination, for example {@code America/New_York}. */
    String arrivalZoneId;
    /** Number of segments; {@code null} uses the builder's configured default. */
    Integer steps;
}
