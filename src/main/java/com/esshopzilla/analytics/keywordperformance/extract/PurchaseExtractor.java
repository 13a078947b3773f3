package com.esshopzilla.analytics.keywordperformance.extract;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Purchase detection and revenue parsing for a single hit.
 */
public final class PurchaseExtractor {

    // event code 1 as a whole token of the comma separated list
    private static final Pattern PURCHASE_EVENT = Pattern.compile("(?:^|,)1(?:,|$)");

    // category;name;quantity;total_revenue;events - 4th field of the first product only
    private static final Pattern FIRST_PRODUCT_REVENUE = Pattern.compile("^[^;]*;[^;]*;[^;]*;([^;,]*)");

    private PurchaseExtractor() {
    }

    public static boolean isPurchaseEvent(String eventList) {
        if (eventList == null || eventList.isEmpty()) {
            return false;
        }
        return PURCHASE_EVENT.matcher(eventList).find();
    }

    /**
     * Revenue of the first product in the list.
     * Later products are not summed; see DESIGN.md.
     *
     * @return the parsed revenue, or 0 when the field is absent, empty, not a number or out of double range
     */
    public static double extractRevenue(String productList) {
        if (productList == null || productList.isEmpty()) {
            return 0.0;
        }
        Matcher m = FIRST_PRODUCT_REVENUE.matcher(productList);
        if (!m.find()) {
            return 0.0;
        }
        String raw = m.group(1).trim();
        if (raw.isEmpty()) {
            return 0.0;
        }
        double revenue;
        try {
            revenue = new BigDecimal(raw).doubleValue();
        } catch (NumberFormatException e) {
            return 0.0;
        }
        // e.g. 1e400 parses but overflows to Infinity
        return Double.isFinite(revenue) ? revenue : 0.0;
    }
}
