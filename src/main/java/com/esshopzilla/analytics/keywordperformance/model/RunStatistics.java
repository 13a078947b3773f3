package com.esshopzilla.analytics.keywordperformance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one attribution run. Computed once, after both passes.
 */
public record RunStatistics(

        @JsonProperty("rows_processed")
        long rowsProcessed,

        @JsonProperty("purchases_found")
        long purchasesFound,

        @JsonProperty("unique_keywords")
        int uniqueKeywords,

        @JsonProperty("total_revenue")
        double totalRevenue,

        @JsonProperty("rows_skipped")
        long rowsSkipped
) {}
