package org.sunside.trajectory.solar;

/**
 * Side of the vehicle's longitudinal axis on which the sun bearing falls.
 */
public enum SunSide {
    LEFT,
    RIGHT
}
