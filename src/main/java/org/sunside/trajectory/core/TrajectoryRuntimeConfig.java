package org.sunside.trajectory.core;

import lombok.Builder;
import lombok.Value;
import org.sunside.trajectory.geometry.GreatCircleInterpolator;
import org.sunside.trajectory.temporal.LocalTimeNormalizer;

/**
 * Runtime configuration bound once when a {@link TrajectoryBuilder} is created.
 */
@Value
@Builder
public class TrajectoryRuntimeConfig {
    public static final int DEFAULT_STEPS = 60;

    /**
     * Segment count used when a request leaves {@code steps} unset.
     */
    @Builder.Default
    int defaultSteps = DEFAULT_STEPS;

    /**
     * Central angle, in radians, at or below which endpoints are treated as identical.
     */
    @Builder.Default
    double coincidentToleranceRadians = GreatCircleInterpolator.DEFAULT_COINCIDENT_TOLERANCE_RADIANS;

    /**
     * Distance from {@code PI}, in radians, at or below which endpoints are treated as antipodal.
     */
    @Builder.Default
    double antipodalToleranceRadians = GreatCircleInterpolator.DEFAULT_ANTIPODAL_TOLERANCE_RADIANS;

    /**
     * Zone id substituted by callers when a zone resolver knows no zone for a coordinate.
     */
    @Builder.Default
    String fallbackZoneId = LocalTimeNormalizer.UTC_ZONE_ID;

    /**
     * Returns the default configuration.
     */
    public static TrajectoryRuntimeConfig defaults() {
        return TrajectoryRuntimeConfig.builder().build();
    }
}
