package com.esshopzilla.analytics.keywordperformance.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to attribute one hit log file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRequest {

    @JsonProperty("input_file")
    private String inputFile;

    // optional, falls back to keyword-performance.output-dir
    @JsonProperty("output_dir")
    private String outputDir;
}
