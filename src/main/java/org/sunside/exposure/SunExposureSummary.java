package org.sunside.exposure;

import lombok.Builder;
import lombok.Value;
import org.sunside.trajectory.core.Trajectory;
import org.sunside.trajectory.core.TrajectorySample;
import org.sunside.trajectory.solar.SunSide;

import java.util.Optional;

/**
 * Daylight counts per vehicle side over one trajectory.
 */
@Value
@Builder(toBuilder = true)
public class SunExposureSummary {
    /** Number of samples in the trajectory. */
    int totalSamples;
    /** Samples with the sun above the horizon. */
    int daylightSamples;
    /** Daylight samples with the sun on the left. */
    int leftDaylightSamples;
    /** Daylight samples with the sun on the right. */
    int rightDaylightSamples;

    /**
     * Returns daylight samples as a whole percentage of all samples, rounded half-up.
     */
    public int daylightPercentage() {
        if (totalSamples == 0) {
            return 0;
        }
        return (int) Math.round(daylightSamples * 100.0d / totalSamples);
    }

    /**
     * Returns the side that sees the sun in more daylight samples, or empty on a tie.
     */
    public Optional<SunSide> sunnierSide() {
        if (leftDaylightSamples == rightDaylightSamples) {
            return Optional.empty();
        }
        return Optional.of(leftDaylightSamples > rightDaylightSamples ? SunSide.LEFT : SunSide.RIGHT);
    }

    /**
     * Summarizes one trajectory.
     */
    public static SunExposureSummary of(Trajectory trajectory) {
        int daylight = 0;
        int left = 0;
        int right = 0;
        for (TrajectorySample sample : trajectory.samples()) {
            if (!sample.daylight()) {
                continue;
            }
            daylight++;
            if (sample.sunSide() == SunSide.LEFT) {
                left++;
            } else {
                right++;
            }
        }
        return SunExposureSummary.builder()
                .totalSamples(trajectory.size())
                .daylightSamples(daylight)
                .leftDaylightSamples(left)
                .rightDaylightSamples(right)
                .build();
    }
}
