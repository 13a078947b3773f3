package com.esshopzilla.analytics.keywordperformance.engine;

import com.esshopzilla.analytics.keywordperformance.extract.PurchaseExtractor;
import com.esshopzilla.analytics.keywordperformance.metrics.Metrics;
import com.esshopzilla.analytics.keywordperformance.model.HitRecord;
import com.esshopzilla.analytics.keywordperformance.model.RecordBatch;
import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;
import com.esshopzilla.analytics.keywordperformance.source.RecordBatchCursor;
import com.esshopzilla.analytics.keywordperformance.source.RecordSource;
import com.esshopzilla.analytics.keywordperformance.state.AggregationState;
import com.esshopzilla.analytics.keywordperformance.state.ReferralIndex;
import com.esshopzilla.analytics.keywordperformance.state.RevenueAccumulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pass 2: credit every purchase to the first referral of its visitor.
 *
 * A purchase counts only if
 * - event list contains code 1
 * - first product revenue is greater than 0
 * - the visitor is present in the referral index
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevenueAggregator {

    private final Metrics metrics;

    public AggregationState aggregate(RecordSource source, ReferralIndex index) {
        if (!index.isSealed()) {
            throw new IllegalStateException("Pass 2 requires a completed referral index");
        }
        log.info("Pass 2: aggregating revenue from {}", source.describe());
        AggregationState state = new AggregationState();

        try (RecordBatchCursor cursor = source.open()) {
            while (cursor.hasNext()) {
                aggregateBatch(cursor.next(), index, state);
            }
        }

        log.info("  Processed {} rows, {} purchases", String.format("%,d", state.getRowsProcessed()),
                state.getPurchasesFound());
        if (state.getRowsSkipped() > 0) {
            log.warn("  Skipped {} rows without a visitor ip", state.getRowsSkipped());
        }
        return state;
    }

    /**
     * Accumulate one batch into a batch-local accumulator, then fold it into the run state.
     */
    public void aggregateBatch(RecordBatch batch, ReferralIndex index, AggregationState state) {
        // counted before any filtering
        state.addRows(batch.rowCount(), batch.rowsSkipped());
        metrics.onBatchScanned(batch.rowCount());
        metrics.onRowsSkipped(batch.rowsSkipped());

        RevenueAccumulator batchRevenue = new RevenueAccumulator();
        int purchases = 0;
        for (HitRecord hit : batch.records()) {
            if (!PurchaseExtractor.isPurchaseEvent(hit.getEventList())) {
                continue;
            }
            double revenue = PurchaseExtractor.extractRevenue(hit.getProductList());
            if (!(revenue > 0)) {
                continue;
            }
            ReferralKey key = index.lookup(hit.getIp());
            if (key == null) {
                log.debug("Purchase at line {} from visitor {} has no search referral", hit.getLineNumber(), hit.getIp());
                continue;
            }
            batchRevenue.add(key, revenue);
            purchases++;
            metrics.onPurchaseAttributed();
        }

        state.getRevenue().merge(batchRevenue);
        state.addPurchases(purchases);
        log.debug("Pass 2 batch: rows={}, purchases={}", batch.rowCount(), purchases);
    }
}
