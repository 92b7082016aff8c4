package com.repoforensics.core.util;

/**
 * Decimal rounding for scores shown to users.
 */
public final class Rounding {

    private Rounding() {
        // Utility class
    }

    /**
     * Rounds to two decimal places, half up.
     *
     * @param value value to round
     * @return rounded value
     */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
