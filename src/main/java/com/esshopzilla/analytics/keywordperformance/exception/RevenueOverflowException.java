package com.esshopzilla.analytics.keywordperformance.exception;

/**
 * Accumulated revenue no longer fits in a double.
 */
public class RevenueOverflowException extends KeywordPerformanceException {

    public RevenueOverflowException(String message) {
        super(message);
    }
}
