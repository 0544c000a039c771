package org.sunside.trajectory.solar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SunSideClassifier Tests")
class SunSideClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0, RIGHT",       // dead ahead
            "0, 90, RIGHT",
            "0, 180, RIGHT",     // dead astern
            "0, 180.0001, LEFT",
            "0, 181, LEFT",
            "0, 270, LEFT",
            "0, 359.999, LEFT",
            "350, 10, RIGHT",    // wrap-around, diff = 20
            "10, 350, LEFT",     // wrap-around, diff = 340
            "270, 90, RIGHT",    // diff = 180
            "308.9, 180, LEFT",  // westbound with southern sun
            "90, 180, RIGHT"     // eastbound with southern sun
    })
    @DisplayName("Side follows the closed [0, 180] right / open (180, 360) left split")
    void testClassify(double heading, double azimuth, SunSide expected) {
        assertEquals(expected, SunSideClassifier.classify(heading, azimuth));
    }

    @ParameterizedTest
    @CsvSource({
            "-90, 0, RIGHT",
            "720, 181, LEFT",
            "0, -90, LEFT",
            "0, 540, RIGHT"
    })
    @DisplayName("Inputs outside [0, 360) are reduced before classifying")
    void testClassifyUnnormalizedInputs(double heading, double azimuth, SunSide expected) {
        assertEquals(expected, SunSideClassifier.classify(heading, azimuth));
    }

    @Test
    @DisplayName("Relative azimuth is reduced into [0, 360)")
    void testRelativeAzimuth() {
        assertEquals(20.0, SunSideClassifier.relativeAzimuth(350.0, 10.0), 1e-12);
        assertEquals(340.0, SunSideClassifier.relativeAzimuth(10.0, 350.0), 1e-12);
        assertEquals(0.0, SunSideClassifier.relativeAzimuth(123.0, 123.0), 0.0);
    }

    @Test
    @DisplayName("Non-finite angles are rejected")
    void testNonFiniteRejected() {
        assertThrows(IllegalArgumentException.class, () -> SunSideClassifier.classify(Double.NaN, 0.0));
        assertThrows(IllegalArgumentException.class, () -> SunSideClassifier.classify(0.0, Double.POSITIVE_INFINITY));
    }
}
