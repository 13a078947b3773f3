package com.esshopzilla.analytics.keywordperformance.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of metrics exposed to the dashboard.
 *
 * Counters are cumulative over the lifetime of the process, across runs.
 */
public record MetricsSnapshot(

        /* -------- Counters -------- */
        long rowsScanned,
        long rowsSkipped,
        long referralsIndexed,
        long purchasesAttributed,

        /* -------- State sizes -------- */
        long referralIndexSize,

        /* -------- Runs -------- */
        long runsCompleted,
        long runsFailed,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
