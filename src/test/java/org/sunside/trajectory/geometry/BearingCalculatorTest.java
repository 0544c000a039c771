package org.sunside.trajectory.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.sunside.core.geo.GeoPoint;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BearingCalculator Tests")
class BearingCalculatorTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0, 0, 90, 90",
            "0, 0, 10, 0, 0",
            "0, 0, -10, 0, 180",
            "0, 0, 0, -90, 270",
            "10, 170, 10, -170, 88.2462"
    })
    @DisplayName("Cardinal and antimeridian bearings")
    void testKnownBearings(double lat1, double lon1, double lat2, double lon2, double expected) {
        double bearing = BearingCalculator.bearing(GeoPoint.of(lat1, lon1), GeoPoint.of(lat2, lon2));
        assertEquals(expected, bearing, 1e-3);
    }

    @Test
    @DisplayName("Istanbul to New York departs north-westward")
    void testIstanbulToNewYork() {
        double bearing = BearingCalculator.bearing(GeoPoint.of(41.2753, 28.7519), GeoPoint.of(40.6413, -73.7781));
        assertTrue(bearing > 300.0 && bearing < 320.0, "unexpected bearing " + bearing);
    }

    @Test
    @DisplayName("Bearing stays in [0, 360) for random coordinates")
    void testBearingRange() {
        Random random = new Random(42L);
        for (int i = 0; i < 10_000; i++) {
            GeoPoint from = GeoPoint.of(random.nextDouble() * 180.0 - 90.0, random.nextDouble() * 360.0 - 180.0);
            GeoPoint to = GeoPoint.of(random.nextDouble() * 180.0 - 90.0, random.nextDouble() * 360.0 - 180.0);
            double bearing = BearingCalculator.bearing(from, to);
            assertTrue(bearing >= 0.0 && bearing < 360.0, "bearing out of range: " + bearing);
        }
    }

    @Test
    @DisplayName("Index 0 uses the due-east convention regardless of points")
    void testFirstSampleConvention() {
        GeoPoint point = GeoPoint.of(41.2753, 28.7519);
        assertEquals(90.0, BearingCalculator.headingAt(0, null, point), 0.0);
        assertEquals(BearingCalculator.FIRST_SAMPLE_HEADING_DEG, BearingCalculator.headingAt(0, point, point), 0.0);
    }

    @Test
    @DisplayName("Later indices use the leg bearing from the previous point")
    void testLaterSampleHeading() {
        assertEquals(0.0, BearingCalculator.headingAt(3, GeoPoint.of(0, 0), GeoPoint.of(10, 0)), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> BearingCalculator.headingAt(-1, null, GeoPoint.of(0, 0)));
        assertThrows(NullPointerException.class, () -> BearingCalculator.headingAt(1, null, GeoPoint.of(0, 0)));
    }
}
