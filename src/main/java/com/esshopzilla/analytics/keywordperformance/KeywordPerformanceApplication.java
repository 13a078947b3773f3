package com.esshopzilla.analytics.keywordperformance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Search Keyword Performance report.
 *
 * Attributes purchase revenue to the search engine and keyword that first brought each
 * visitor to the site, using two bounded-memory passes over the hit log.
 */
@Slf4j
@SpringBootApplication
public class KeywordPerformanceApplication {

    public static void main(String[] args) {
        log.info("Starting Search Keyword Performance Application...");
        SpringApplication.run(KeywordPerformanceApplication.class, args);
        log.info("Search Keyword Performance Application started successfully");
    }
}
