package com.esshopzilla.analytics.keywordperformance.state;

import com.esshopzilla.analytics.keywordperformance.exception.RevenueOverflowException;
import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RevenueAccumulatorTest {

    private static final ReferralKey GOOGLE_IPOD = new ReferralKey("www.google.com", "ipod");
    private static final ReferralKey BING_ZUNE = new ReferralKey("www.bing.com", "zune");

    @Test
    void testAddCreatesAndSums() {
        RevenueAccumulator acc = new RevenueAccumulator();

        acc.add(GOOGLE_IPOD, 290.0);
        acc.add(GOOGLE_IPOD, 10.0);
        acc.add(BING_ZUNE, 250.0);

        assertThat(acc.get(GOOGLE_IPOD)).isEqualTo(300.0);
        assertThat(acc.get(BING_ZUNE)).isEqualTo(250.0);
        assertThat(acc.size()).isEqualTo(2);
    }

    @Test
    void testMissingKeyReadsAsZero() {
        RevenueAccumulator acc = new RevenueAccumulator();

        assertThat(acc.get(GOOGLE_IPOD)).isZero();
        assertThat(acc.isEmpty()).isTrue();
    }

    @Test
    void testNegativeOrNonFiniteRevenueRejected() {
        RevenueAccumulator acc = new RevenueAccumulator();

        assertThatThrownBy(() -> acc.add(GOOGLE_IPOD, -1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> acc.add(GOOGLE_IPOD, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> acc.add(GOOGLE_IPOD, Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(acc.isEmpty()).isTrue();
    }

    @Test
    void testMergeAddsPartialResults() {
        RevenueAccumulator left = new RevenueAccumulator();
        left.add(GOOGLE_IPOD, 100.0);

        RevenueAccumulator right = new RevenueAccumulator();
        right.add(GOOGLE_IPOD, 50.0);
        right.add(BING_ZUNE, 250.0);

        left.merge(right);

        assertThat(left.get(GOOGLE_IPOD)).isEqualTo(150.0);
        assertThat(left.get(BING_ZUNE)).isEqualTo(250.0);
        // the merged-in accumulator is left untouched
        assertThat(right.get(GOOGLE_IPOD)).isEqualTo(50.0);
    }

    @Test
    void testSumLeavingDoubleRangeRejected() {
        RevenueAccumulator acc = new RevenueAccumulator();
        acc.add(GOOGLE_IPOD, 1e308);

        assertThatThrownBy(() -> acc.add(GOOGLE_IPOD, 1e308)).isInstanceOf(RevenueOverflowException.class);
        assertThat(acc.get(GOOGLE_IPOD)).isEqualTo(1e308);
    }

    @Test
    void testMergeLeavingDoubleRangeRejected() {
        RevenueAccumulator left = new RevenueAccumulator();
        left.add(GOOGLE_IPOD, 1e308);
        RevenueAccumulator right = new RevenueAccumulator();
        right.add(GOOGLE_IPOD, 1e308);

        assertThatThrownBy(() -> left.merge(right)).isInstanceOf(RevenueOverflowException.class);
        assertThat(left.get(GOOGLE_IPOD)).isEqualTo(1e308);
    }
}
