package com.esshopzilla.analytics.keywordperformance.metrics;

import com.esshopzilla.analytics.keywordperformance.engine.KeywordPerformanceEngine;
import com.esshopzilla.analytics.keywordperformance.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MetricsRegistryTest {

    @Test
    void testCountersAccumulateAcrossRuns() {
        MetricsRegistry metrics = new MetricsRegistry();
        KeywordPerformanceEngine engine = TestFactory.createEngine(metrics);

        engine.run(TestFactory.source(TestFactory.SAMPLE_DATA));
        engine.run(TestFactory.source(TestFactory.SAMPLE_DATA, 1));

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.runsCompleted()).isEqualTo(2);
        assertThat(snapshot.runsFailed()).isZero();
        assertThat(snapshot.purchasesAttributed()).isEqualTo(4);
        assertThat(snapshot.referralsIndexed()).isEqualTo(4);
        assertThat(snapshot.referralIndexSize()).isEqualTo(2);
    }

    @Test
    void testSkippedRowsIgnoresZero() {
        MetricsRegistry metrics = new MetricsRegistry();

        metrics.onRowsSkipped(0);
        metrics.onRowsSkipped(3);

        assertThat(metrics.snapshot().rowsSkipped()).isEqualTo(3);
    }
}
