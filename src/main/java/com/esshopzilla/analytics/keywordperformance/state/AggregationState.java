package com.esshopzilla.analytics.keywordperformance.state;

import lombok.Getter;

/**
 * Everything Pass 2 accumulates for one run: revenue per key plus the counters
 * that end up in the run statistics.
 */
@Getter
public class AggregationState {

    private final RevenueAccumulator revenue = new RevenueAccumulator();

    private long rowsProcessed;
    private long rowsSkipped;
    private long purchasesFound;

    public void addRows(int rows, int skipped) {
        rowsProcessed += rows;
        rowsSkipped += skipped;
    }

    public void addPurchases(int purchases) {
        purchasesFound += purchases;
    }
}
