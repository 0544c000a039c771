package org.sunside.core.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("GeoPoint Tests")
class GeoPointTest {

    @Test
    @DisplayName("Valid coordinates are stored verbatim and convert to radians")
    void testValidCoordinates() {
        GeoPoint point = GeoPoint.of(41.2753, 28.7519);
        assertEquals(41.2753, point.latitude(), 0.0);
        assertEquals(28.7519, point.longitude(), 0.0);
        assertEquals(Math.toRadians(41.2753), point.latitudeRadians(), 1e-15);
        assertEquals(Math.toRadians(28.7519), point.longitudeRadians(), 1e-15);
    }

    @Test
    @DisplayName("Boundary coordinates are accepted")
    void testBoundaryCoordinates() {
        assertEquals(90.0, GeoPoint.of(90.0, 180.0).latitude(), 0.0);
        assertEquals(-180.0, GeoPoint.of(-90.0, -180.0).longitude(), 0.0);
    }

    @ParameterizedTest
    @CsvSource({
            "90.0001, 0",
            "-90.0001, 0",
            "0, 180.0001",
            "0, -180.0001",
            "NaN, 0",
            "0, Infinity"
    })
    @DisplayName("Out-of-range or non-finite coordinates are rejected")
    void testInvalidCoordinatesRejected(double latitude, double longitude) {
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(latitude, longitude));
    }

    @Test
    @DisplayName("Points with equal components are equal values")
    void testValueEquality() {
        assertEquals(GeoPoint.of(40.6413, -73.7781), GeoPoint.of(40.6413, -73.7781));
        assertEquals(GeoPoint.of(40.6413, -73.7781).hashCode(), GeoPoint.of(40.6413, -73.7781).hashCode());
        assertNotEquals(GeoPoint.of(40.6413, -73.7781), GeoPoint.of(40.6413, -73.7780));
    }
}
