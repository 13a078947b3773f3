package com.esshopzilla.analytics.keywordperformance;

import com.esshopzilla.analytics.keywordperformance.engine.ReportService;
import com.esshopzilla.analytics.keywordperformance.model.KeywordPerformanceReport;
import com.esshopzilla.analytics.keywordperformance.model.KeywordRevenue;
import com.esshopzilla.analytics.keywordperformance.output.RevenueFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * One-shot run on startup when {@code keyword-performance.input-file} is set.
 * An optional {@code keyword-performance.output-file} overrides the dated report name.
 */
@Slf4j
@Component
public class ReportRunner implements ApplicationRunner {

    private final ReportService reportService;
    private final String inputFile;
    private final String outputFile;

    public ReportRunner(
            ReportService reportService,
            @Value("${keyword-performance.input-file:}") String inputFile,
            @Value("${keyword-performance.output-file:}") String outputFile
    ) {
        this.reportService = reportService;
        this.inputFile = inputFile;
        this.outputFile = outputFile;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (inputFile == null || inputFile.isBlank()) {
            log.info("No keyword-performance.input-file configured, waiting for requests");
            return;
        }
        Path input = Paths.get(inputFile);
        Path output = outputFile == null || outputFile.isBlank()
                ? reportService.getDefaultOutputDir().resolve(reportService.reportFileName())
                : Paths.get(outputFile);

        KeywordPerformanceReport report = reportService.generateReport(input, output);
        logReport(report, output);
    }

    private void logReport(KeywordPerformanceReport report, Path output) {
        log.info("==================================================");
        for (KeywordRevenue row : report.rows()) {
            log.info("{}\t{}\t{}", row.getDomain(), row.getKeyword(), RevenueFormat.format(row.getRevenue()));
        }
        log.info("Total Revenue: ${}", String.format("%,.2f", report.statistics().totalRevenue()));
        log.info("Output: {}", output);
    }
}
