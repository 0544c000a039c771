package org.sunside.trajectory.core;

import lombok.Value;
import lombok.experimental.Accessors;
import org.sunside.core.geo.GeoPoint;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, fully populated trajectory between two boundary points.
 *
 * <p>Construction enforces the ordering contract: at least two samples with consecutive
 * indices from 0, the first timestamp equal to {@link #departureTime}, the last equal to
 * {@link #arrivalTime}, and timestamps non-decreasing in between.</p>
 */
@Value
@Accessors(fluent = true)
public class Trajectory {
    GeoPoint departurePoint;
    GeoPoint arrivalPoint;
    Instant departureTime;
    Instant arrivalTime;
    List<TrajectorySample> samples;

    /**
     * Creates a validated trajectory.
     *
     * @throws IllegalArgumentException when the samples violate the ordering contract.
     */
    public Trajectory(
            GeoPoint departurePoint,
            GeoPoint arrivalPoint,
            Instant departureTime,
            Instant arrivalTime,
            List<TrajectorySample> samples
    ) {
        this.departurePoint = Objects.requireNonNull(departurePoint, "departurePoint");
        this.arrivalPoint = Objects.requireNonNull(arrivalPoint, "arrivalPoint");
        this.departureTime = Objects.requireNonNull(departureTime, "departureTime");
        this.arrivalTime = Objects.requireNonNull(arrivalTime, "arrivalTime");
        this.samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
        validateSamples();
    }

    /**
     * Returns the number of samples.
     */
    public int size() {
        return samples.size();
    }

    /**
     * Returns sample {@code index}.
     */
    public TrajectorySample sample(int index) {
        return samples.get(index);
    }

    /**
     * Returns the departure sample.
     */
    public TrajectorySample first() {
        return samples.get(0);
    }

    /**
     * Returns the arrival sample.
     */
    public TrajectorySample last() {
        return samples.get(samples.size() - 1);
    }

    private void validateSamples() {
        if (samples.size() < 2) {
            throw new IllegalArgumentException("trajectory requires at least 2 samples, got " + samples.size());
        }
        Instant previous = null;
        for (int i = 0; i < samples.size(); i++) {
            TrajectorySample sample = samples.get(i);
            if (sample.index() != i) {
                throw new IllegalArgumentException("sample at position " + i + " has index " + sample.index());
            }
            if (previous != null && sample.timestamp().isBefore(previous)) {
                throw new IllegalArgumentException("sample " + i + " timestamp precedes sample " + (i - 1));
            }
            previous = sample.timestamp();
        }
        if (!first().timestamp().equals(departureTime)) {
            throw new IllegalArgumentException("first sample timestamp must equal departureTime");
        }
        if (!last().timestamp().equals(arrivalTime)) {
            throw new IllegalArgumentException("last sample timestamp must equal arrivalTime");
        }
    }
}
