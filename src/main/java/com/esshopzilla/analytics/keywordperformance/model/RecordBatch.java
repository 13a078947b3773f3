package com.esshopzilla.analytics.keywordperformance.model;

import java.util.List;

/**
 * A bounded group of hit records read together.
 *
 * @param records     records with a visitor identifier
 * @param rowsSkipped data rows read but dropped because they carried no visitor identifier
 */
public record RecordBatch(List<HitRecord> records, int rowsSkipped) {

    public RecordBatch {
        records = List.copyOf(records);
    }

    /**
     * Number of data rows this batch consumed from the input, before any filtering.
     */
    public int rowCount() {
        return records.size() + rowsSkipped;
    }
}
