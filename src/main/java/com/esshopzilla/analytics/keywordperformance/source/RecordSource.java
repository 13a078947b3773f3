package com.esshopzilla.analytics.keywordperformance.source;

/**
 * Factory of fresh batch sequences over the same logical input.
 * <p>
 * Every call to {@link #open()} starts again from the first record, which is what allows
 * two independent linear scans of a file too large to keep in memory.
 */
public interface RecordSource {

    /**
     * Open a new cursor positioned before the first batch.
     *
     * @throws com.esshopzilla.analytics.keywordperformance.exception.InvalidInputException     header misses a required column
     * @throws com.esshopzilla.analytics.keywordperformance.exception.InputUnavailableException input cannot be opened
     */
    RecordBatchCursor open();

    /**
     * Human readable name of the input, for logs.
     */
    String describe();
}
