package com.esshopzilla.analytics.keywordperformance.engine;

import com.esshopzilla.analytics.keywordperformance.metrics.NoOpMetrics;
import com.esshopzilla.analytics.keywordperformance.model.RecordBatch;
import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;
import com.esshopzilla.analytics.keywordperformance.state.AggregationState;
import com.esshopzilla.analytics.keywordperformance.state.ReferralIndex;
import com.esshopzilla.analytics.keywordperformance.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.esshopzilla.analytics.keywordperformance.testutil.TestFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RevenueAggregatorTest {

    private static final ReferralKey GOOGLE_IPOD = new ReferralKey("www.google.com", "ipod");

    private final RevenueAggregator aggregator = new RevenueAggregator(new NoOpMetrics());

    private ReferralIndex sealedIndex() {
        ReferralIndex index = new ReferralIndex();
        index.recordIfAbsent("1.1.1.1", GOOGLE_IPOD);
        index.seal();
        return index;
    }

    @Test
    void testRequiresCompletedIndex() {
        ReferralIndex open = new ReferralIndex();

        assertThatThrownBy(() -> aggregator.aggregate(TestFactory.source(TestFactory.SAMPLE_DATA), open))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testOnlyAttributablePurchasesCount() {
        AggregationState state = new AggregationState();
        RecordBatch batch = new RecordBatch(List.of(
                record("1.1.1.1", "1", "Cat;Ipod;1;290;", null),       // counted
                record("1.1.1.1", "2", "Cat;Ipod;1;100;", null),       // not a purchase
                record("1.1.1.1", "1", "Cat;Ipod;1;;", null),          // no revenue
                record("1.1.1.1", "1", "Cat;Ipod;1;0;", null),         // zero revenue
                record("9.9.9.9", "1", "Cat;Ipod;1;500;", null),       // never came from search
                record("1.1.1.1", "2,1", "Cat;Ipod;1;10.5;", null)     // counted
        ), 0);

        aggregator.aggregateBatch(batch, sealedIndex(), state);

        assertThat(state.getPurchasesFound()).isEqualTo(2);
        assertThat(state.getRevenue().get(GOOGLE_IPOD)).isEqualTo(300.5);
        assertThat(state.getRevenue().size()).isEqualTo(1);
    }

    /**
     * Every row is counted, including rows that were filtered or skipped.
     */
    @Test
    void testRowsCountedBeforeFiltering() {
        AggregationState state = new AggregationState();

        aggregator.aggregateBatch(new RecordBatch(List.of(
                record("5.5.5.5", null, null, null),
                record("6.6.6.6", null, null, null)
        ), 3), sealedIndex(), state);

        assertThat(state.getRowsProcessed()).isEqualTo(5);
        assertThat(state.getRowsSkipped()).isEqualTo(3);
        assertThat(state.getPurchasesFound()).isZero();
    }

    @Test
    void testAccumulatesAcrossBatches() {
        AggregationState state = new AggregationState();
        ReferralIndex index = sealedIndex();

        aggregator.aggregateBatch(new RecordBatch(List.of(
                record("1.1.1.1", "1", "Cat;Ipod;1;100;", null)), 0), index, state);
        aggregator.aggregateBatch(new RecordBatch(List.of(
                record("1.1.1.1", "1", "Cat;Ipod;1;50;", null)), 0), index, state);

        assertThat(state.getRevenue().get(GOOGLE_IPOD)).isEqualTo(150.0);
        assertThat(state.getPurchasesFound()).isEqualTo(2);
        assertThat(state.getRowsProcessed()).isEqualTo(2);
    }
}
