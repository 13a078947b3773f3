package com.esshopzilla.analytics.keywordperformance.metrics;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong rowsScanned = new AtomicLong();
    private final AtomicLong rowsSkipped = new AtomicLong();
    private final AtomicLong referralsIndexed = new AtomicLong();
    private final AtomicLong purchasesAttributed = new AtomicLong();

    private final AtomicLong referralIndexSize = new AtomicLong();

    private final AtomicLong runsCompleted = new AtomicLong();
    private final AtomicLong runsFailed = new AtomicLong();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());


    @Override
    public void onBatchScanned(int rows) {
        rowsScanned.addAndGet(rows);
        touch();
    }

    @Override
    public void onRowsSkipped(int rows) {
        if (rows <= 0) {
            return;
        }
        rowsSkipped.addAndGet(rows);
        touch();
    }

    @Override
    public void onReferralIndexed() {
        referralsIndexed.incrementAndGet();
        touch();
    }

    @Override
    public void onPurchaseAttributed() {
        purchasesAttributed.incrementAndGet();
        touch();
    }

    @Override
    public void onReferralIndexSizeUpdated(long size) {
        referralIndexSize.set(size);
        touch();
    }

    @Override
    public void onRunCompleted() {
        runsCompleted.incrementAndGet();
        touch();
    }

    @Override
    public void onRunFailed() {
        runsFailed.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                rowsScanned.get(),
                rowsSkipped.get(),
                referralsIndexed.get(),
                purchasesAttributed.get(),
                referralIndexSize.get(),
                runsCompleted.get(),
                runsFailed.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
