package com.esshopzilla.analytics.keywordperformance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the result table: revenue attributed to a search engine keyword.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordRevenue {

    @JsonProperty("search_engine_domain")
    private String domain;

    @JsonProperty("search_keyword")
    private String keyword;

    @JsonProperty("revenue")
    private double revenue;
}
