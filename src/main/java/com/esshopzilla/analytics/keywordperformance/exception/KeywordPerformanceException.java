package com.esshopzilla.analytics.keywordperformance.exception;

/**
 * Base type for failures that abort a whole attribution run.
 * Row-level problems never surface as exceptions.
 */
public class KeywordPerformanceException extends RuntimeException {

    public KeywordPerformanceException(String message) {
        super(message);
    }

    public KeywordPerformanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
