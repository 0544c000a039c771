package org.sunside.trajectory.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;
import org.sunside.core.geo.GeoPoint;
import org.sunside.trajectory.solar.SunSide;

import java.time.Instant;

/**
 * One annotated point of a trajectory.
 */
@Value
@Builder
@Accessors(fluent = true)
public class TrajectorySample {
    /** Position in the trajectory, starting at 0. */
    int index;
    /** Sample coordinate. */
    @NonNull
    GeoPoint point;
    /** UTC instant at which the vehicle is at {@link #point}. */
    @NonNull
    Instant timestamp;
    /** Heading in {@code [0, 360)}; fixed at 90 for index 0. */
    double headingDeg;
    /** Sun altitude in degrees. */
    double solarAltitudeDeg;
    /** Sun azimuth in {@code [0, 360)}. */
    double solarAzimuthDeg;
    /** Side of the vehicle facing the sun. */
    @NonNull
    SunSide sunSide;

    /**
     * Returns whether the sun is above the horizon.
     */
    public boolean daylight() {
        return solarAltitudeDeg > 0.0d;
    }
}
