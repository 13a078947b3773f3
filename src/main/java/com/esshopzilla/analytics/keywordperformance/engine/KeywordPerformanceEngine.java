package com.esshopzilla.analytics.keywordperformance.engine;

import com.esshopzilla.analytics.keywordperformance.metrics.Metrics;
import com.esshopzilla.analytics.keywordperformance.model.KeywordPerformanceReport;
import com.esshopzilla.analytics.keywordperformance.source.RecordSource;
import com.esshopzilla.analytics.keywordperformance.state.AggregationState;
import com.esshopzilla.analytics.keywordperformance.state.ReferralIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Core two-pass first-touch attribution.
 * <p>
 * Pass 1 must finish before Pass 2 starts: every lookup in Pass 2 needs the complete index.
 * All state lives in objects created per call, so concurrent runs over different inputs are independent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordPerformanceEngine {

    private final ReferralIndexBuilder referralIndexBuilder;
    private final RevenueAggregator revenueAggregator;
    private final ResultMaterializer resultMaterializer;
    private final Metrics metrics;

    /**
     * Run both passes over the source.
     *
     * @throws com.esshopzilla.analytics.keywordperformance.exception.KeywordPerformanceException on fatal input errors
     */
    public KeywordPerformanceReport run(RecordSource source) {
        try {
            ReferralIndex index = referralIndexBuilder.build(source);
            AggregationState state = revenueAggregator.aggregate(source, index);
            KeywordPerformanceReport report = resultMaterializer.materialize(state);
            metrics.onRunCompleted();

            log.info("Attribution of {} finished: {}", source.describe(), report.statistics());
            return report;
        } catch (RuntimeException e) {
            metrics.onRunFailed();
            log.error("Attribution of {} failed", source.describe(), e);
            throw e;
        }
    }
}
