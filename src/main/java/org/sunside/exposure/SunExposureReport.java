package org.sunside.exposure;

import lombok.Builder;
import lombok.Value;
import org.sunside.trajectory.core.Trajectory;

/**
 * Result of one sun-exposure computation.
 */
@Value
@Builder
public class SunExposureReport {
    /** Annotated trajectory. */
    Trajectory trajectory;
    /** Zone id applied to the departure time, possibly the fallback. */
    String departureZoneId;
    /** Zone id applied to the arrival time, possibly the fallback. */
    String arrivalZoneId;
    /** Daylight counts per side. */
    SunExposureSummary summary;
}
