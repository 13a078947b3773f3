package com.esshopzilla.analytics.keywordperformance.exception;

/**
 * The result table could not be written to its destination.
 */
public class ReportWriteException extends KeywordPerformanceException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
