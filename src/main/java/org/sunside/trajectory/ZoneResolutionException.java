package org.sunside.trajectory;

/**
 * Thrown when a time-zone identifier cannot be resolved or parsed.
 */
public final class ZoneResolutionException extends TrajectoryException {
    public static final String REASON_ZONE_RESOLUTION_FAILED = "TZ_ZONE_RESOLUTION_FAILED";
    public static final String REASON_INVALID_ZONE_ID = "TZ_INVALID_ZONE_ID";

    public ZoneResolutionException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public ZoneResolutionException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
