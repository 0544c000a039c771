package org.sunside.exposure;

import lombok.Builder;
import lombok.Value;
import org.sunside.core.geo.GeoPoint;

import java.time.LocalDateTime;

/**
 * Travel segment whose endpoint zones are resolved from coordinates.
 */
@Value
@Builder(toBuilder = true)
public class FlightSegmentRequest {
    /** Departure coordinate. */
    GeoPoint departure;
    /** Arrival coordinate. */
    GeoPoint arrival;
    /** Departure wall-clock time at the departure coordinate. */
    LocalDateTime departureLocalTime;
    /** Arrival wall-clock time at the arrival coordinate. */
    LocalDateTime arrivalLocalTime;
    /** Number of segments; {@code null} uses the configured default. */
    Integer steps;
}
