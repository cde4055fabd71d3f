package com.aiprov.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Display rounding for percentages. Aggregation always works on the precise
 * values; only the final figure shown to a reader is rounded.
 */
public final class Percentages {
    private Percentages() {
    }

    public static BigDecimal display(Double value, int scale) {
        if (value == null) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(Math.max(0, scale), RoundingMode.HALF_UP);
    }

    static Double ratio(long part, long whole) {
        if (whole == 0) {
            return null;
        }
        return part * 100.0 / whole;
    }
}
