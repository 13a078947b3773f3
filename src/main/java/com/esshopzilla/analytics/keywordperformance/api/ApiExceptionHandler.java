package com.esshopzilla.analytics.keywordperformance.api;

import com.esshopzilla.analytics.keywordperformance.exception.InputUnavailableException;
import com.esshopzilla.analytics.keywordperformance.exception.InvalidInputException;
import com.esshopzilla.analytics.keywordperformance.exception.KeywordPerformanceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps run failures to HTTP responses: bad input is the caller's problem (400), the rest is ours (500).
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> invalidInput(InvalidInputException e) {
        log.warn("Invalid input: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), e.getMissingColumns()));
    }

    @ExceptionHandler(InputUnavailableException.class)
    public ResponseEntity<ErrorResponse> inputUnavailable(InputUnavailableException e) {
        log.warn("Input unavailable: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(KeywordPerformanceException.class)
    public ResponseEntity<ErrorResponse> runFailed(KeywordPerformanceException e) {
        log.error("Report run failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> unexpected(RuntimeException e) {
        log.error("Unexpected failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(String.valueOf(e.getMessage())));
    }
}
