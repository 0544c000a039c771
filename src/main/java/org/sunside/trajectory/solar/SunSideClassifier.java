package org.sunside.trajectory.solar;

import lombok.experimental.UtilityClass;
import org.sunside.trajectory.geometry.SphericalMath;

/**
 * Classifies the solar azimuth as left or right of a heading.
 *
 * <p>With {@code diff = (azimuth - heading) mod 360}, the closed interval {@code [0, 180]}
 * is {@link SunSide#RIGHT} and the open interval {@code (180, 360)} is {@link SunSide#LEFT}.
 * A sun dead ahead ({@code diff = 0}) or dead astern ({@code diff = 180}) is therefore RIGHT.</p>
 */
@UtilityClass
public class SunSideClassifier {
    private static final double HALF_TURN_DEGREES = 180.0d;

    /**
     * Returns the side of {@code headingDeg} on which {@code solarAzimuthDeg} lies.
     *
     * @param headingDeg direction of travel, degrees clockwise from north.
     * @param solarAzimuthDeg sun direction, degrees clockwise from north.
     * @return sun side.
     */
    public static SunSide classify(double headingDeg, double solarAzimuthDeg) {
        if (!Double.isFinite(headingDeg) || !Double.isFinite(solarAzimuthDeg)) {
            throw new IllegalArgumentException(
                    "heading and azimuth must be finite: " + headingDeg + ", " + solarAzimuthDeg
            );
        }
        double diff = relativeAzimuth(headingDeg, solarAzimuthDeg);
        return diff <= HALF_TURN_DEGREES ? SunSide.RIGHT : SunSide.LEFT;
    }

    /**
     * Returns the sun bearing relative to the heading, in {@code [0, 360)}.
     */
    public static double relativeAzimuth(double headingDeg, double solarAzimuthDeg) {
        return SphericalMath.normalizeDegrees(solarAzimuthDeg - headingDeg);
    }
}
