package com.eainde.forecast.model;

/**
 * Helpers for the [0,1] confidence scale used by metrics, insights and aggregate scores.
 */
public final class Confidence {

    private Confidence() {
    }

    /**
     * Clamps a value into [0,1]. NaN maps to 0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Clamps a value into [-1,1]. NaN maps to 0.
     */
    public static double clampSigned(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
