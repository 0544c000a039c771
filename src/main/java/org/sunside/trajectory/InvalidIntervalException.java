package org.sunside.trajectory;

/**
 * Thrown when an arrival instant precedes its departure instant.
 */
public final class InvalidIntervalException extends TrajectoryException {
    public static final String REASON_INVALID_INTERVAL = "TS_INVALID_INTERVAL";

    public InvalidIntervalException(String message) {
        super(REASON_INVALID_INTERVAL, message);
    }
}
