package org.sunside.trajectory.solar;

import org.sunside.core.geo.GeoPoint;
import org.sunside.trajectory.geometry.SphericalMath;

import java.time.Instant;
import java.util.Objects;

/**
 * Solar position provider based on the NOAA general solar position algorithm.
 *
 * <p>Accuracy is around a tenth of a degree for dates between 1901 and 2099, which is
 * ample for side-of-vehicle classification. Altitude includes an atmospheric refraction
 * correction. Stateless and safe for concurrent use.</p>
 */
public final class NoaaSolarPositionProvider implements SolarPositionProvider {
    private static final double SECONDS_PER_DAY = 86_400.0d;
    private static final double MINUTES_PER_DAY = 1_440.0d;
    private static final double JULIAN_DAY_AT_UNIX_EPOCH = 2_440_587.5d;
    private static final double JULIAN_DAY_J2000 = 2_451_545.0d;
    private static final double DAYS_PER_JULIAN_CENTURY = 36_525.0d;
    private static final double AZIMUTH_DENOMINATOR_EPSILON = 1e-12d;

    @Override
    public SolarPosition position(GeoPoint point, Instant instant) {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(instant, "instant");

        double epochSeconds = instant.getEpochSecond() + instant.getNano() / 1e9d;
        double julianDay = epochSeconds / SECONDS_PER_DAY + JULIAN_DAY_AT_UNIX_EPOCH;
        double julianCentury = (julianDay - JULIAN_DAY_J2000) / DAYS_PER_JULIAN_CENTURY;

        double geomMeanLongSun = SphericalMath.normalizeDegrees(
                280.46646d + julianCentury * (36000.76983d + julianCentury * 0.0003032d));
        double geomMeanAnomSun = 357.52911d + julianCentury * (35999.05029d - 0.0001537d * julianCentury);
        double eccentEarthOrbit = 0.016708634d - julianCentury * (0.000042037d + 0.0000001267d * julianCentury);

        double anomRad = Math.toRadians(geomMeanAnomSun);
        double sunEqOfCtr = Math.sin(anomRad) * (1.914602d - julianCentury * (0.004817d + 0.000014d * julianCentury))
                + Math.sin(2.0d * anomRad) * (0.019993d - 0.000101d * julianCentury)
                + Math.sin(3.0d * anomRad) * 0.000289d;
        double sunTrueLong = geomMeanLongSun + sunEqOfCtr;
        double omega = Math.toRadians(125.04d - 1934.136d * julianCentury);
        double sunAppLong = sunTrueLong - 0.00569d - 0.00478d * Math.sin(omega);

        double meanObliqEcliptic = 23.0d + (26.0d + (21.448d - julianCentury
                * (46.815d + julianCentury * (0.00059d - julianCentury * 0.001813d))) / 60.0d) / 60.0d;
        double obliqCorr = meanObliqEcliptic + 0.00256d * Math.cos(omega);
        double obliqRad = Math.toRadians(obliqCorr);

        double declinationRad = Math.asin(Math.sin(obliqRad) * Math.sin(Math.toRadians(sunAppLong)));

        double y = Math.tan(obliqRad / 2.0d) * Math.tan(obliqRad / 2.0d);
        double meanLongRad = Math.toRadians(geomMeanLongSun);
        double eqOfTimeMinutes = 4.0d * Math.toDegrees(
                y * Math.sin(2.0d * meanLongRad)
                        - 2.0d * eccentEarthOrbit * Math.sin(anomRad)
                        + 4.0d * eccentEarthOrbit * y * Math.sin(anomRad) * Math.cos(2.0d * meanLongRad)
                        - 0.5d * y * y * Math.sin(4.0d * meanLongRad)
                        - 1.25d * eccentEarthOrbit * eccentEarthOrbit * Math.sin(2.0d * anomRad));

        double utcMinutes = floorMod(epochSeconds / 60.0d, MINUTES_PER_DAY);
        double trueSolarMinutes = floorMod(utcMinutes + eqOfTimeMinutes + 4.0d * point.longitude(), MINUTES_PER_DAY);
        double hourAngleDeg = trueSolarMinutes / 4.0d - 180.0d;

        double latRad = point.latitudeRadians();
        double cosZenith = clampUnit(Math.sin(latRad) * Math.sin(declinationRad)
                + Math.cos(latRad) * Math.cos(declinationRad) * Math.cos(Math.toRadians(hourAngleDeg)));
        double zenithRad = Math.acos(cosZenith);
        double elevationDeg = 90.0d - Math.toDegrees(zenithRad);

        double altitudeDeg = elevationDeg + refractionCorrectionDeg(elevationDeg);
        double azimuthDeg = azimuthDeg(latRad, declinationRad, zenithRad, hourAngleDeg);
        return new SolarPosition(altitudeDeg, azimuthDeg);
    }

    private static double azimuthDeg(double latRad, double declinationRad, double zenithRad, double hourAngleDeg) {
        double denominator = Math.cos(latRad) * Math.sin(zenithRad);
        if (Math.abs(denominator) < AZIMUTH_DENOMINATOR_EPSILON) {
            // Sun at zenith or observer at a pole: azimuth is undefined, point along the meridian.
            return latRad >= declinationRad ? 180.0d : 0.0d;
        }
        double cosAzimuth = clampUnit(
                (Math.sin(latRad) * Math.cos(zenithRad) - Math.sin(declinationRad)) / denominator);
        double angleDeg = Math.toDegrees(Math.acos(cosAzimuth));
        if (hourAngleDeg > 0.0d) {
            return SphericalMath.normalizeDegrees(angleDeg + 180.0d);
        }
        return SphericalMath.normalizeDegrees(540.0d - angleDeg);
    }

    /**
     * Approximate atmospheric refraction in degrees for a geometric elevation.
     */
    private static double refractionCorrectionDeg(double elevationDeg) {
        double arcSeconds;
        if (elevationDeg > 85.0d) {
            arcSeconds = 0.0d;
        } else if (elevationDeg > 5.0d) {
            double tanElevation = Math.tan(Math.toRadians(elevationDeg));
            arcSeconds = 58.1d / tanElevation
                    - 0.07d / Math.pow(tanElevation, 3)
                    + 0.000086d / Math.pow(tanElevation, 5);
        } else if (elevationDeg > -0.575d) {
            arcSeconds = 1735.0d + elevationDeg * (-518.2d + elevationDeg
                    * (103.4d + elevationDeg * (-12.79d + elevationDeg * 0.711d)));
        } else {
            arcSeconds = -20.772d / Math.tan(Math.toRadians(elevationDeg));
        }
        return arcSeconds / 3600.0d;
    }

    private static double floorMod(double value, double modulus) {
        double result = value % modulus;
        return result < 0.0d ? result + modulus : result;
    }

    private static double clampUnit(double value) {
        return Math.max(-1.0d, Math.min(1.0d, value));
    }
}
