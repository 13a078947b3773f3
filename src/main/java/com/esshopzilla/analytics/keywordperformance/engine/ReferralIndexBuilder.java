package com.esshopzilla.analytics.keywordperformance.engine;

import com.esshopzilla.analytics.keywordperformance.extract.SearchReferralExtractor;
import com.esshopzilla.analytics.keywordperformance.metrics.Metrics;
import com.esshopzilla.analytics.keywordperformance.model.HitRecord;
import com.esshopzilla.analytics.keywordperformance.model.RecordBatch;
import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;
import com.esshopzilla.analytics.keywordperformance.source.RecordBatchCursor;
import com.esshopzilla.analytics.keywordperformance.source.RecordSource;
import com.esshopzilla.analytics.keywordperformance.state.ReferralIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Pass 1: find the first search engine referral of every visitor.
 * <p>
 * Batches are consumed strictly in source order, since "first" means first in file order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferralIndexBuilder {

    private final Metrics metrics;

    /**
     * Scan the whole source and return a sealed index.
     */
    public ReferralIndex build(RecordSource source) {
        log.info("Pass 1: finding first search referrals in {}", source.describe());
        ReferralIndex index = new ReferralIndex();

        try (RecordBatchCursor cursor = source.open()) {
            while (cursor.hasNext()) {
                RecordBatch batch = cursor.next();
                int added = indexBatch(batch, index);
                log.debug("Pass 1 batch: rows={}, new visitors={}", batch.rowCount(), added);
                metrics.onReferralIndexSizeUpdated(index.size());
            }
        }

        index.seal();
        log.info("  Found {} users from search engines", index.size());
        return index;
    }

    /**
     * Record the referrals of one batch.
     *
     * @return number of visitors added to the index by this batch
     */
    public int indexBatch(RecordBatch batch, ReferralIndex index) {
        int added = 0;
        for (HitRecord hit : batch.records()) {
            Optional<ReferralKey> referral = SearchReferralExtractor.extractSearchReferral(hit.getReferrer());
            if (referral.isEmpty()) {
                continue;
            }
            if (index.recordIfAbsent(hit.getIp(), referral.get())) {
                added++;
                metrics.onReferralIndexed();
            }
        }
        return added;
    }
}
