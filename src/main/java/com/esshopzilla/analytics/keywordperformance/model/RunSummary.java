package com.esshopzilla.analytics.keywordperformance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a caller gets back after a report file has been produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    @JsonProperty("input")
    private String input;

    @JsonProperty("output")
    private String output;

    @JsonUnwrapped
    private RunStatistics statistics;
}
