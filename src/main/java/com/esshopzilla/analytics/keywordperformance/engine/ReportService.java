package com.esshopzilla.analytics.keywordperformance.engine;

import com.esshopzilla.analytics.keywordperformance.model.KeywordPerformanceReport;
import com.esshopzilla.analytics.keywordperformance.model.RunSummary;
import com.esshopzilla.analytics.keywordperformance.output.ReportWriter;
import com.esshopzilla.analytics.keywordperformance.source.TsvRecordSource;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Runs the attribution over a file and stores the result as a dated report.
 *
 * Output file name: {@code <yyyy-MM-dd>_SearchKeywordPerformance.tab}
 */
@Slf4j
@Service
public class ReportService {

    public static final String REPORT_SUFFIX = "_SearchKeywordPerformance.tab";

    private final KeywordPerformanceEngine engine;
    private final ReportWriter reportWriter;
    private final CsvMapper csvMapper;
    private final Clock clock;
    private final int batchSize;
    private final Path defaultOutputDir;

    public ReportService(
            KeywordPerformanceEngine engine,
            ReportWriter reportWriter,
            CsvMapper csvMapper,
            Clock clock,
            @Value("${keyword-performance.batch-size:500000}") int batchSize,
            @Value("${keyword-performance.output-dir:./output}") String defaultOutputDir
    ) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("keyword-performance.batch-size must be positive: " + batchSize);
        }
        this.engine = engine;
        this.reportWriter = reportWriter;
        this.csvMapper = csvMapper;
        this.clock = clock;
        this.batchSize = batchSize;
        this.defaultOutputDir = Paths.get(defaultOutputDir);
        log.info("Initialized ReportService with batch size {} and output dir {}", batchSize, defaultOutputDir);
    }

    /**
     * @param input     hit log to process
     * @param outputDir directory for the report, or null for the configured default
     */
    public RunSummary generate(Path input, Path outputDir) {
        Path dir = outputDir != null ? outputDir : defaultOutputDir;
        Path output = dir.resolve(reportFileName());

        KeywordPerformanceReport report = generateReport(input, output);

        return RunSummary.builder()
                .input(input.toString())
                .output(output.toString())
                .statistics(report.statistics())
                .build();
    }

    /**
     * Run the attribution and write the table to exactly {@code output}.
     */
    public KeywordPerformanceReport generateReport(Path input, Path output) {
        KeywordPerformanceReport report = engine.run(TsvRecordSource.ofFile(input, batchSize, csvMapper));
        reportWriter.write(report, output);
        return report;
    }

    public String reportFileName() {
        return LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE) + REPORT_SUFFIX;
    }

    public Path getDefaultOutputDir() {
        return defaultOutputDir;
    }
}
