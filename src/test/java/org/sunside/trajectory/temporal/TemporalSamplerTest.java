package org.sunside.trajectory.temporal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sunside.trajectory.InsufficientSamplesException;
import org.sunside.trajectory.InvalidIntervalException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("TemporalSampler Tests")
class TemporalSamplerTest {
    private static final Instant DEPARTURE = Instant.parse("2023-12-01T05:00:00Z");
    private static final Instant ARRIVAL = Instant.parse("2023-12-01T16:00:00Z");

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 61, 1000})
    @DisplayName("Sequence starts at departure, ends at arrival, and never decreases")
    void testBoundariesAndMonotonicity(int pointCount) {
        List<Instant> times = TemporalSampler.sampleTimes(DEPARTURE, ARRIVAL, pointCount);
        assertEquals(pointCount, times.size());
        assertEquals(DEPARTURE, times.get(0));
        assertEquals(ARRIVAL, times.get(pointCount - 1));
        for (int i = 1; i < times.size(); i++) {
            assertFalse(times.get(i).isBefore(times.get(i - 1)), "time decreased at index " + i);
        }
    }

    @Test
    @DisplayName("Samples are linearly spaced")
    void testLinearSpacing() {
        List<Instant> times = TemporalSampler.sampleTimes(DEPARTURE, ARRIVAL, 61);
        for (int i = 0; i < times.size(); i++) {
            assertEquals(DEPARTURE.plus(Duration.ofMinutes(11L * i)), times.get(i));
        }
    }

    @Test
    @DisplayName("Uneven division truncates to the nanosecond without drifting")
    void testUnevenDivision() {
        Instant end = DEPARTURE.plusSeconds(1);
        List<Instant> times = TemporalSampler.sampleTimes(DEPARTURE, end, 4);
        assertEquals(DEPARTURE.plusNanos(333_333_333L), times.get(1));
        assertEquals(DEPARTURE.plusNanos(666_666_666L), times.get(2));
        assertEquals(end, times.get(3));
    }

    @Test
    @DisplayName("Zero-length interval yields repeated departure instant")
    void testZeroLengthInterval() {
        List<Instant> times = TemporalSampler.sampleTimes(DEPARTURE, DEPARTURE, 5);
        assertEquals(5, times.size());
        times.forEach(time -> assertEquals(DEPARTURE, time));
    }

    @Test
    @DisplayName("Arrival before departure is rejected with deterministic reason code")
    void testInvalidInterval() {
        InvalidIntervalException ex = assertThrows(
                InvalidIntervalException.class,
                () -> TemporalSampler.sampleTimes(ARRIVAL, DEPARTURE, 10)
        );
        assertEquals(InvalidIntervalException.REASON_INVALID_INTERVAL, ex.reasonCode());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 0, -5})
    @DisplayName("Fewer than two points are rejected")
    void testInsufficientPoints(int pointCount) {
        InsufficientSamplesException ex = assertThrows(
                InsufficientSamplesException.class,
                () -> TemporalSampler.sampleTimes(DEPARTURE, ARRIVAL, pointCount)
        );
        assertEquals(InsufficientSamplesException.REASON_INSUFFICIENT_SAMPLES, ex.reasonCode());
    }

    @Test
    @DisplayName("Null instants are rejected")
    void testNullInstants() {
        assertThrows(NullPointerException.class, () -> TemporalSampler.sampleTimes(null, ARRIVAL, 2));
        assertThrows(NullPointerException.class, () -> TemporalSampler.sampleTimes(DEPARTURE, null, 2));
    }

    @Test
    @DisplayName("Widest representable interval samples without overflow")
    void testWidestInterval() {
        List<Instant> times = TemporalSampler.sampleTimes(Instant.MIN, Instant.MAX, 1001);
        assertEquals(Instant.MIN, times.get(0));
        assertEquals(Instant.ofEpochSecond(-31493900263187578L, 399_999_999L), times.get(1));
        assertEquals(Instant.ofEpochSecond(-62151408001L, 999_999_999L), times.get(500));
        assertEquals(Instant.ofEpochSecond(31493775960371577L, 599_999_999L), times.get(999));
        assertEquals(Instant.MAX, times.get(1000));
        for (int i = 1; i < times.size(); i++) {
            assertFalse(times.get(i).isBefore(times.get(i - 1)), "time decreased at index " + i);
        }
    }
}
