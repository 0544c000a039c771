package org.sunside.trajectory;

/**
 * Thrown when the injected solar position provider fails or returns an unusable position.
 *
 * <p>Providers may throw this type directly; the engine rethrows it unchanged.</p>
 */
public final class SolarProviderException extends TrajectoryException {
    public static final String REASON_PROVIDER_FAILED = "SP_PROVIDER_FAILED";
    public static final String REASON_INVALID_POSITION = "SP_INVALID_POSITION";

    public SolarProviderException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public SolarProviderException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
