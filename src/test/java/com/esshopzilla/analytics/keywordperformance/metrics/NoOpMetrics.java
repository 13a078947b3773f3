package com.esshopzilla.analytics.keywordperformance.metrics;

import java.time.Instant;

/**
 * No-op metrics implementation.
 * Used for tests or when metrics collection is disabled.
 */
public class NoOpMetrics implements Metrics {

    /* -------- Input -------- */

    @Override
    public void onBatchScanned(int rows) {
        // no-op
    }

    @Override
    public void onRowsSkipped(int rows) {
        // no-op
    }

    /* -------- Attribution -------- */

    @Override
    public void onReferralIndexed() {
        // no-op
    }

    @Override
    public void onPurchaseAttributed() {
        // no-op
    }

    /* -------- State -------- */

    @Override
    public void onReferralIndexSizeUpdated(long size) {
        // no-op
    }

    /* -------- Runs -------- */

    @Override
    public void onRunCompleted() {
        // no-op
    }

    @Override
    public void onRunFailed() {
        // no-op
    }

    /* -------- Snapshot -------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                0,          // rowsScanned
                0,          // rowsSkipped
                0,          // referralsIndexed
                0,          // purchasesAttributed
                0,          // referralIndexSize
                0,          // runsCompleted
                0,          // runsFailed
                Instant.now()
        );
    }
}
