package org.sunside.trajectory;

/**
 * Thrown when two endpoints are antipodal and no unique great-circle route exists.
 */
public final class AmbiguousRouteException extends TrajectoryException {
    public static final String REASON_ANTIPODAL_ENDPOINTS = "GC_ANTIPODAL_ENDPOINTS";

    public AmbiguousRouteException(String message) {
        super(REASON_ANTIPODAL_ENDPOINTS, message);
    }
}
