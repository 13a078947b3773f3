package com.esshopzilla.analytics.keywordperformance.exception;

/**
 * The input could not be opened or read.
 */
public class InputUnavailableException extends KeywordPerformanceException {

    public InputUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
