package com.esshopzilla.analytics.keywordperformance.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("missing_columns") List<String> missingColumns
) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, List.of());
    }
}
