package com.esshopzilla.analytics.keywordperformance.metrics;

/**
 * Lightweight metrics API used by the attribution passes and exposed via /metrics.
 */

public interface Metrics {

    void onBatchScanned(int rows);

    void onRowsSkipped(int rows);

    void onReferralIndexed();

    void onPurchaseAttributed();

    void onReferralIndexSizeUpdated(long size);

    void onRunCompleted();

    void onRunFailed();

    MetricsSnapshot snapshot();
}
