package com.esshopzilla.analytics.keywordperformance.output;

import com.esshopzilla.analytics.keywordperformance.exception.ReportWriteException;
import com.esshopzilla.analytics.keywordperformance.model.KeywordPerformanceReport;
import com.esshopzilla.analytics.keywordperformance.model.KeywordRevenue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes the result table as tab separated values.
 * <p>
 * The header is always written, so an empty table produces a header-only file.
 * File output goes through a temporary sibling file that is moved into place at the end;
 * a failed run leaves no partial report behind.
 */
@Slf4j
@Component
public class ReportWriter {

    public static final String[] HEADER = {"Search Engine Domain", "Search Keyword", "Revenue"};

    private final ObjectWriter rowWriter;
    private final AtomicLong reportsWritten = new AtomicLong(0);

    public ReportWriter(CsvMapper csvMapper) {
        CsvSchema schema = CsvSchema.emptySchema()
                .withColumnSeparator('\t')
                .withoutQuoteChar()
                .withoutEscapeChar()
                .withLineSeparator("\n");
        this.rowWriter = csvMapper
                .writerFor(String[].class)
                .with(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    /**
     * Write header and rows to the given writer. The writer is flushed but not closed.
     */
    public void write(KeywordPerformanceReport report, Writer out) throws IOException {
        try (SequenceWriter rows = rowWriter.writeValues(out)) {
            rows.write(HEADER);
            for (KeywordRevenue row : report.rows()) {
                rows.write(new String[]{
                        row.getDomain(),
                        row.getKeyword(),
                        RevenueFormat.format(row.getRevenue())
                });
            }
        }
        out.flush();
    }

    /**
     * Write the report to a file, replacing any existing file at that path.
     *
     * @throws ReportWriteException if the file cannot be written
     */
    public Path write(KeywordPerformanceReport report, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                write(report, out);
            }
            moveIntoPlace(tmp, target);
            long count = reportsWritten.incrementAndGet();
            log.info("Wrote {} rows to {} (total reports: {})", report.rows().size(), target, count);
            return target;
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            log.error("Failed to write report {}", target, e);
            throw new ReportWriteException("Failed to write report " + target, e);
        }
    }

    public long getReportsWritten() {
        return reportsWritten.get();
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary report {}", tmp, e);
        }
    }
}
