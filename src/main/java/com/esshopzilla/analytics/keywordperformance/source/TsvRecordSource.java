package com.esshopzilla.analytics.keywordperformance.source;

import com.esshopzilla.analytics.keywordperformance.exception.InputUnavailableException;
import com.esshopzilla.analytics.keywordperformance.exception.InvalidInputException;
import com.esshopzilla.analytics.keywordperformance.model.HitRecord;
import com.esshopzilla.analytics.keywordperformance.model.RecordBatch;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads tab separated hit logs with a header row.
 * <p>
 * Required columns are located by name, in any order; other columns are never read.
 * Rows are parsed positionally so a short or long row degrades to missing values
 * instead of failing the scan. Blank lines are skipped and not counted.
 */
@Slf4j
public class TsvRecordSource implements RecordSource {

    public static final String COL_IP = "ip";
    public static final String COL_REFERRER = "referrer";
    public static final String COL_EVENT_LIST = "event_list";
    public static final String COL_PRODUCT_LIST = "product_list";

    public static final List<String> REQUIRED_COLUMNS =
            List.of(COL_IP, COL_REFERRER, COL_EVENT_LIST, COL_PRODUCT_LIST);

    public static final int DEFAULT_BATCH_SIZE = 500_000;

    private static final char SEPARATOR = '\t';

    private final ReaderFactory readerFactory;
    private final String name;
    private final int batchSize;
    private final ObjectReader rowReader;

    public TsvRecordSource(ReaderFactory readerFactory, String name, int batchSize, CsvMapper csvMapper) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.readerFactory = readerFactory;
        this.name = name;
        this.batchSize = batchSize;

        CsvSchema schema = CsvSchema.emptySchema()
                .withColumnSeparator(SEPARATOR)
                .withoutQuoteChar()
                .withoutEscapeChar();
        this.rowReader = csvMapper
                .readerFor(String[].class)
                .with(schema)
                .with(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    public static TsvRecordSource ofFile(Path file, int batchSize, CsvMapper csvMapper) {
        return new TsvRecordSource(
                // InputStreamReader replaces malformed bytes instead of failing the scan
                () -> new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8),
                file.toString(),
                batchSize,
                csvMapper
        );
    }

    public static TsvRecordSource ofString(String content, int batchSize, CsvMapper csvMapper) {
        return new TsvRecordSource(() -> new StringReader(content), "<memory>", batchSize, csvMapper);
    }

    @Override
    public RecordBatchCursor open() {
        BufferedReader reader;
        try {
            reader = new BufferedReader(readerFactory.openReader());
        } catch (IOException e) {
            throw new InputUnavailableException("Cannot open input " + name, e);
        }

        try {
            Map<String, Integer> columns = readHeader(reader);
            MappingIterator<String[]> rows = rowReader.readValues(reader);
            return new Cursor(reader, rows, columns);
        } catch (IOException e) {
            closeQuietly(reader);
            throw new InputUnavailableException("Cannot read input " + name, e);
        } catch (RuntimeException e) {
            closeQuietly(reader);
            throw e;
        }
    }

    @Override
    public String describe() {
        return name;
    }

    private Map<String, Integer> readHeader(BufferedReader reader) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            throw new InvalidInputException("Input " + name + " is empty, expected a header row", REQUIRED_COLUMNS);
        }
        if (!headerLine.isEmpty() && headerLine.charAt(0) == '\uFEFF') {
            headerLine = headerLine.substring(1);
        }

        Map<String, Integer> positions = new HashMap<>();
        String[] names = headerLine.split(String.valueOf(SEPARATOR), -1);
        for (int i = 0; i < names.length; i++) {
            positions.putIfAbsent(names[i].trim(), i);
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(c -> !positions.containsKey(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new InvalidInputException("Input " + name + " is missing required columns " + missing, missing);
        }

        Map<String, Integer> required = new HashMap<>();
        REQUIRED_COLUMNS.forEach(c -> required.put(c, positions.get(c)));
        log.debug("Resolved column positions for {}: {}", name, required);
        return required;
    }

    private static void closeQuietly(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close input reader", e);
        }
    }

    private final class Cursor implements RecordBatchCursor {

        private final BufferedReader reader;
        private final MappingIterator<String[]> rows;
        private final int ipIdx;
        private final int referrerIdx;
        private final int eventListIdx;
        private final int productListIdx;

        // header is line 1
        private long lineNumber = 1;
        private boolean closed;

        Cursor(BufferedReader reader, MappingIterator<String[]> rows, Map<String, Integer> columns) {
            this.reader = reader;
            this.rows = rows;
            this.ipIdx = columns.get(COL_IP);
            this.referrerIdx = columns.get(COL_REFERRER);
            this.eventListIdx = columns.get(COL_EVENT_LIST);
            this.productListIdx = columns.get(COL_PRODUCT_LIST);
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            try {
                boolean more = rows.hasNextValue();
                if (!more) {
                    close();
                }
                return more;
            } catch (IOException e) {
                close();
                throw new InputUnavailableException("Failed reading " + name + " after line " + lineNumber, e);
            }
        }

        @Override
        public RecordBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more batches in " + name);
            }
            List<HitRecord> records = new ArrayList<>(Math.min(batchSize, 8192));
            int skipped = 0;
            int read = 0;
            try {
                while (read < batchSize && rows.hasNextValue()) {
                    String[] row = rows.nextValue();
                    lineNumber++;
                    if (isBlankLine(row)) {
                        continue;
                    }
                    read++;
                    HitRecord hit = toHitRecord(row);
                    if (hit.hasVisitor()) {
                        records.add(hit);
                    } else {
                        skipped++;
                        log.warn("Skipping row at line {} of {}: no visitor ip", lineNumber, name);
                    }
                }
            } catch (IOException e) {
                close();
                throw new InputUnavailableException("Failed reading " + name + " after line " + lineNumber, e);
            }
            log.debug("Read batch of {} rows from {} (skipped={})", read, name, skipped);
            return new RecordBatch(records, skipped);
        }

        private boolean isBlankLine(String[] row) {
            return row.length == 0 || (row.length == 1 && (row[0] == null || row[0].isBlank()));
        }

        private HitRecord toHitRecord(String[] row) {
            return HitRecord.builder()
                    .ip(column(row, ipIdx))
                    .referrer(column(row, referrerIdx))
                    .eventList(column(row, eventListIdx))
                    .productList(column(row, productListIdx))
                    .lineNumber(lineNumber)
                    .build();
        }

        private String column(String[] row, int idx) {
            if (idx >= row.length) {
                return null;
            }
            String value = row[idx];
            return value == null || value.isEmpty() ? null : value;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                rows.close();
            } catch (IOException e) {
                log.warn("Failed to close row iterator for {}", name, e);
            }
            closeQuietly(reader);
        }
    }
}
