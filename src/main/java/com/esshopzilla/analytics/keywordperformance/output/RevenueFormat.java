package com.esshopzilla.analytics.keywordperformance.output;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Two fractional digits, rounded half-even on the exact binary value of the double.
 */
public final class RevenueFormat {

    private RevenueFormat() {
    }

    public static String format(double revenue) {
        return new BigDecimal(revenue).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }
}
