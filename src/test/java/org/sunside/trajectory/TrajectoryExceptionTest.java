package org.sunside.trajectory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TrajectoryException Tests")
class TrajectoryExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessagePrefix() {
        TrajectoryException ex = new TrajectoryException("TB_SAMPLE", "something failed");
        assertEquals("TB_SAMPLE", ex.reasonCode());
        assertEquals("[TB_SAMPLE] something failed", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCausePreserved() {
        IllegalStateException cause = new IllegalStateException("boom");
        TrajectoryException ex = new TrajectoryException("TB_SAMPLE", "wrapped", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or null reason codes are rejected")
    void testReasonCodeRequired() {
        assertThrows(IllegalArgumentException.class, () -> new TrajectoryException("  ", "message"));
        assertThrows(NullPointerException.class, () -> new TrajectoryException(null, "message"));
        assertThrows(NullPointerException.class, () -> new TrajectoryException("TB_SAMPLE", null));
    }

    @Test
    @DisplayName("Typed failures carry their fixed reason codes")
    void testTypedReasonCodes() {
        assertEquals(AmbiguousRouteException.REASON_ANTIPODAL_ENDPOINTS,
                new AmbiguousRouteException("x").reasonCode());
        assertEquals(InvalidIntervalException.REASON_INVALID_INTERVAL,
                new InvalidIntervalException("x").reasonCode());
        assertEquals(InsufficientSamplesException.REASON_INSUFFICIENT_SAMPLES,
                new InsufficientSamplesException("x").reasonCode());
        assertTrue(new SolarProviderException(SolarProviderException.REASON_PROVIDER_FAILED, "x")
                .getMessage().startsWith("[SP_PROVIDER_FAILED]"));
        assertEquals(ZoneResolutionException.REASON_INVALID_ZONE_ID,
                new ZoneResolutionException(ZoneResolutionException.REASON_INVALID_ZONE_ID, "x").reasonCode());
    }
}
