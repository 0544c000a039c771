package org.sunside.trajectory.temporal;

import lombok.experimental.UtilityClass;
import org.sunside.trajectory.InsufficientSamplesException;
import org.sunside.trajectory.InvalidIntervalException;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Uniform temporal sampling between a departure and an arrival instant.
 *
 * <p>Assumes constant ground speed: sample {@code i} of {@code n} is placed at
 * {@code departure + i * (arrival - departure) / (n - 1)}, truncated to the nanosecond.</p>
 */
@UtilityClass
public class TemporalSampler {
    public static final int MIN_SAMPLE_POINTS = 2;

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    /**
     * Returns {@code pointCount} linearly spaced instants.
     *
     * @param departure first instant.
     * @param arrival last instant, not before {@code departure}.
     * @param pointCount number of instants, at least 2.
     * @return immutable, non-decreasing instant sequence starting at {@code departure}
     * and ending at {@code arrival}.
     * @throws InvalidIntervalException when {@code arrival} precedes {@code departure}.
     * @throws InsufficientSamplesException when {@code pointCount < 2}.
     */
    public static List<Instant> sampleTimes(Instant departure, Instant arrival, int pointCount) {
        Objects.requireNonNull(departure, "departure");
        Objects.requireNonNull(arrival, "arrival");
        if (arrival.isBefore(departure)) {
            throw new InvalidIntervalException(
                    "arrival " + arrival + " precedes departure " + departure
            );
        }
        if (pointCount < MIN_SAMPLE_POINTS) {
            throw new InsufficientSamplesException(
                    "pointCount must be >= " + MIN_SAMPLE_POINTS + ", got " + pointCount
            );
        }

        BigInteger totalNanos = toNanos(Duration.between(departure, arrival));
        int lastIndex = pointCount - 1;
        BigInteger divisor = BigInteger.valueOf(lastIndex);
        List<Instant> times = new ArrayList<>(pointCount);
        times.add(departure);
        for (int i = 1; i < lastIndex; i++) {
            BigInteger offsetNanos = totalNanos.multiply(BigInteger.valueOf(i)).divide(divisor);
            times.add(departure.plus(fromNanos(offsetNanos)));
        }
        times.add(arrival);
        return Collections.unmodifiableList(times);
    }

    // Exact for any interval between two Instants.
    private static BigInteger toNanos(Duration duration) {
        return BigInteger.valueOf(duration.getSeconds())
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(duration.getNano()));
    }

    private static Duration fromNanos(BigInteger nanos) {
        BigInteger[] secondsAndNanos = nanos.divideAndRemainder(NANOS_PER_SECOND);
        return Duration.ofSeconds(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValue());
    }
}
