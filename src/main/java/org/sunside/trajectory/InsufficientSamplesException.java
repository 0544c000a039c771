package org.sunside.trajectory;

/**
 * Thrown when a sample or step count is too small to span both endpoints.
 */
public final class InsufficientSamplesException extends TrajectoryException {
    public static final String REASON_INSUFFICIENT_SAMPLES = "TS_INSUFFICIENT_SAMPLES";

    public InsufficientSamplesException(String message) {
        super(REASON_INSUFFICIENT_SAMPLES, message);
    }
}
