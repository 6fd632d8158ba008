package com.codelogickeep.coverage.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Percentage arithmetic shared by every summary level.
 * All percentages are rounded half-up to two decimal places.
 */
public final class Percentages {

    private static final int SCALE = 2;

    private Percentages() {
    }

    /**
     * covered / total * 100, or 0 when total is 0.
     */
    public static double of(long covered, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round((double) covered / total * 100.0);
    }

    /**
     * Converts a 0.0-1.0 rate into a percentage.
     */
    public static double fromRate(double rate) {
        if (Double.isNaN(rate) || Double.isInfinite(rate)) {
            return 0.0;
        }
        return round(rate * 100.0);
    }

    public static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
