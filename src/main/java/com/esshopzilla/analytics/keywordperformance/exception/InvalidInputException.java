package com.esshopzilla.analytics.keywordperformance.exception;

import java.util.List;

/**
 * The input does not satisfy the column contract, e.g. a required column is missing from the header.
 */
public class InvalidInputException extends KeywordPerformanceException {

    private final List<String> missingColumns;

    public InvalidInputException(String message, List<String> missingColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
