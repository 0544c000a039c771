package org.sunside.trajectory.solar;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Sun position seen from one point at one instant.
 */
@Value
@Accessors(fluent = true)
public class SolarPosition {
    /** Angle above the local horizon in degrees; negative below the horizon. */
    double altitudeDeg;
    /** Compass direction of the sun in degrees, 0 = north, clockwise. */
    double azimuthDeg;
}
