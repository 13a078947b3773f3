package com.esshopzilla.analytics.keywordperformance.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Search engine domain plus the normalized keyword typed into it.
 * An empty keyword means the referrer carried no q/p parameter.
 */
public record ReferralKey(String domain, String keyword) {

    /**
     * Domain first, then keyword. Used to break revenue ties deterministically.
     */
    public static final Comparator<ReferralKey> NATURAL_ORDER = Comparator
            .comparing(ReferralKey::domain)
            .thenComparing(ReferralKey::keyword);

    public ReferralKey {
        Objects.requireNonNull(domain, "domain");
        keyword = keyword == null ? "" : keyword;
    }
}
