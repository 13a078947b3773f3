package com.esshopzilla.analytics.keywordperformance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents one row of the hit-level log. Only the columns used for attribution are kept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HitRecord {

    private String ip;

    private String referrer;

    private String eventList;

    private String productList;

    // Metadata for diagnostics: 1-based line in the source file
    private transient long lineNumber;

    public boolean hasVisitor() {
        return ip != null && !ip.isBlank();
    }
}
