package com.esshopzilla.analytics.keywordperformance.engine;

import com.esshopzilla.analytics.keywordperformance.exception.RevenueOverflowException;
import com.esshopzilla.analytics.keywordperformance.model.KeywordPerformanceReport;
import com.esshopzilla.analytics.keywordperformance.model.KeywordRevenue;
import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;
import com.esshopzilla.analytics.keywordperformance.model.RunStatistics;
import com.esshopzilla.analytics.keywordperformance.state.AggregationState;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns the revenue accumulator into the sorted result table and its statistics.
 */
@Component
public class ResultMaterializer {

    /**
     * Highest revenue first; ties by domain, then keyword, so output is identical across runs.
     */
    static final Comparator<Map.Entry<ReferralKey, Double>> RESULT_ORDER =
            Map.Entry.<ReferralKey, Double>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.<ReferralKey, Double>comparingByKey(ReferralKey.NATURAL_ORDER));

    public KeywordPerformanceReport materialize(AggregationState state) {
        List<KeywordRevenue> rows = state.getRevenue().asMap().entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .sorted(RESULT_ORDER)
                .map(e -> KeywordRevenue.builder()
                        .domain(e.getKey().domain())
                        .keyword(e.getKey().keyword())
                        .revenue(e.getValue())
                        .build())
                .toList();

        double totalRevenue = 0.0;
        for (KeywordRevenue row : rows) {
            totalRevenue += row.getRevenue();
        }
        if (!Double.isFinite(totalRevenue)) {
            throw new RevenueOverflowException("Total revenue exceeds the double range");
        }

        RunStatistics statistics = new RunStatistics(
                state.getRowsProcessed(),
                state.getPurchasesFound(),
                rows.size(),
                totalRevenue,
                state.getRowsSkipped()
        );
        return new KeywordPerformanceReport(rows, statistics);
    }
}
