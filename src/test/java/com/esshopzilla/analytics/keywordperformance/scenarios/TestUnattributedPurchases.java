package com.esshopzilla.analytics.keywordperformance.scenarios;

import com.esshopzilla.analytics.keywordperformance.engine.KeywordPerformanceEngine;
import com.esshopzilla.analytics.keywordperformance.model.KeywordPerformanceReport;
import com.esshopzilla.analytics.keywordperformance.model.KeywordRevenue;
import com.esshopzilla.analytics.keywordperformance.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import static com.esshopzilla.analytics.keywordperformance.testutil.TestFactory.hit;
import static com.esshopzilla.analytics.keywordperformance.testutil.TestFactory.hits;
import static org.assertj.core.api.Assertions.assertThat;

public class TestUnattributedPurchases {

    @Test
    void testInternalReferrerIgnored() {
        String data = hits(
                hit("1.1.1.1", "", "", "http://www.esshopzilla.com/page"),
                hit("1.1.1.1", "1", "Cat;Prod;1;100;", "http://www.esshopzilla.com/checkout")
        );
        KeywordPerformanceEngine engine = TestFactory.createEngine();

        KeywordPerformanceReport report = engine.run(TestFactory.source(data));

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.statistics().purchasesFound()).isZero();
        assertThat(report.statistics().totalRevenue()).isZero();
        assertThat(report.statistics().rowsProcessed()).isEqualTo(2);
    }

    @Test
    void testNoPurchaseEventNoRevenue() {
        String data = hits(
                hit("1.1.1.1", "", "", "http://www.google.com/search?q=test"),
                hit("1.1.1.1", "2", "Cat;Prod;1;100;", "http://site.com")
        );
        KeywordPerformanceEngine engine = TestFactory.createEngine();

        KeywordPerformanceReport report = engine.run(TestFactory.source(data));

        assertThat(report.isEmpty()).isTrue();
    }

    /**
     * A purchase from a visitor with no search referral is dropped and not counted,
     * while the other visitor's purchase is still attributed.
     */
    @Test
    void testPurchaseWithoutReferralDoesNotInflateCount() {
        String data = hits(
                hit("1.1.1.1", "", "", "http://www.bing.com/search?q=Zune"),
                hit("2.2.2.2", "1", "Cat;Ipod;1;290;", "http://site.com"),
                hit("1.1.1.1", "1", "Cat;Zune;1;250;", "http://site.com")
        );
        KeywordPerformanceEngine engine = TestFactory.createEngine();

        KeywordPerformanceReport report = engine.run(TestFactory.source(data));

        assertThat(report.rows()).extracting(KeywordRevenue::getKeyword).containsExactly("zune");
        assertThat(report.statistics().purchasesFound()).isEqualTo(1);
        assertThat(report.statistics().totalRevenue()).isEqualTo(250.0);
    }

    @Test
    void testPurchaseEventCodeBoundary() {
        String data = hits(
                hit("1.1.1.1", "", "", "http://www.google.com/search?q=ipod"),
                hit("1.1.1.1", "2", "Cat;A;1;1;", "http://site.com"),
                hit("1.1.1.1", "12", "Cat;B;1;2;", "http://site.com"),
                hit("1.1.1.1", "1", "Cat;C;1;4;", "http://site.com"),
                hit("1.1.1.1", "1,2", "Cat;D;1;8;", "http://site.com"),
                hit("1.1.1.1", "2,1", "Cat;E;1;16;", "http://site.com")
        );
        KeywordPerformanceEngine engine = TestFactory.createEngine();

        KeywordPerformanceReport report = engine.run(TestFactory.source(data));

        assertThat(report.statistics().purchasesFound()).isEqualTo(3);
        assertThat(report.rows()).extracting(KeywordRevenue::getRevenue).containsExactly(28.0);
    }
}
