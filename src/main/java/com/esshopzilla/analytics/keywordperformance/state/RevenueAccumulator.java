package com.esshopzilla.analytics.keywordperformance.state;

import com.esshopzilla.analytics.keywordperformance.exception.RevenueOverflowException;
import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Running revenue per referral key. Values only ever grow.
 */
public class RevenueAccumulator {

    private final ConcurrentMap<ReferralKey, Double> revenueByKey = new ConcurrentHashMap<>();

    /**
     * Add one purchase's revenue to the key, creating the entry at 0 if needed.
     *
     * @throws IllegalArgumentException for negative or non-finite revenue
     * @throws RevenueOverflowException if the key's total leaves the double range
     */
    public void add(ReferralKey key, double revenue) {
        if (!Double.isFinite(revenue) || revenue < 0) {
            throw new IllegalArgumentException("Revenue must be a finite non-negative number: " + revenue);
        }
        revenueByKey.merge(key, revenue, (current, extra) -> checkedSum(key, current, extra));
    }

    /**
     * Fold another accumulator, typically one batch's partial sums, into this one.
     *
     * @throws RevenueOverflowException if a key's total leaves the double range
     */
    public RevenueAccumulator merge(RevenueAccumulator other) {
        other.revenueByKey.forEach((key, revenue) ->
                revenueByKey.merge(key, revenue, (current, extra) -> checkedSum(key, current, extra)));
        return this;
    }

    private static double checkedSum(ReferralKey key, double current, double extra) {
        double sum = current + extra;
        if (!Double.isFinite(sum)) {
            throw new RevenueOverflowException("Revenue for " + key + " exceeds the double range");
        }
        return sum;
    }

    public double get(ReferralKey key) {
        return revenueByKey.getOrDefault(key, 0.0);
    }

    public Map<ReferralKey, Double> asMap() {
        return Collections.unmodifiableMap(revenueByKey);
    }

    public int size() {
        return revenueByKey.size();
    }

    public boolean isEmpty() {
        return revenueByKey.isEmpty();
    }
}
