package com.esshopzilla.analytics.keywordperformance.model;

import java.util.List;

/**
 * Sorted result table plus the statistics computed from it.
 */
public record KeywordPerformanceReport(List<KeywordRevenue> rows, RunStatistics statistics) {

    public KeywordPerformanceReport {
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
