package com.esshopzilla.analytics.keywordperformance.extract;

import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the search engine domain and the typed keyword out of a referrer URL.
 *
 * Input : http://search.yahoo.com/search?p=cd+player
 * Output: (search.yahoo.com, "cd player")
 */
public final class SearchReferralExtractor {

    /**
     * Hosts counted as search engines. Matched case-sensitively, exactly as captured.
     */
    public static final Set<String> SEARCH_ENGINE_DOMAINS = Set.of(
            "google.com", "www.google.com",
            "bing.com", "www.bing.com",
            "search.yahoo.com", "yahoo.com", "www.yahoo.com",
            "msn.com"
    );

    private static final Pattern HOST_PATTERN = Pattern.compile("https?://([^/]+)");
    private static final Pattern KEYWORD_PATTERN = Pattern.compile("[?&][qp]=([^&]+)");

    private SearchReferralExtractor() {
    }

    /**
     * @return the referral key when the referrer points at a recognized search engine, empty otherwise
     */
    public static Optional<ReferralKey> extractSearchReferral(String referrer) {
        String domain = extractDomain(referrer);
        if (domain == null || !SEARCH_ENGINE_DOMAINS.contains(domain)) {
            return Optional.empty();
        }
        String keyword = extractKeyword(referrer);
        return Optional.of(new ReferralKey(domain, keyword == null ? "" : keyword));
    }

    /**
     * Host portion of an http(s) URL, case preserved. Null when the referrer is not such a URL.
     */
    public static String extractDomain(String referrer) {
        if (referrer == null || referrer.isEmpty()) {
            return null;
        }
        Matcher m = HOST_PATTERN.matcher(referrer);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Value of the first q or p query parameter with only '+' and "%20" decoded, lower-cased.
     * No other percent-decoding is applied.
     */
    public static String extractKeyword(String referrer) {
        if (referrer == null || referrer.isEmpty()) {
            return null;
        }
        Matcher m = KEYWORD_PATTERN.matcher(referrer);
        if (!m.find()) {
            return null;
        }
        return m.group(1)
                .replace("+", " ")
                .replace("%20", " ")
                .toLowerCase(Locale.ROOT);
    }
}
