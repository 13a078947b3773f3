package com.esshopzilla.analytics.keywordperformance.state;

import com.esshopzilla.analytics.keywordperformance.model.ReferralKey;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * First search referral seen per visitor.
 * <p>
 * Write-once per visitor: the first {@link #recordIfAbsent} wins and later referrals for the
 * same visitor are ignored. putIfAbsent keeps that true even if writers race.
 * <p>
 * Once {@link #seal()} has been called the index is read-only. Instances are owned by a single run.
 */
@Slf4j
public class ReferralIndex {

    /**
     * visitor ip -> first referral
     */
    private final ConcurrentMap<String, ReferralKey> firstReferralByVisitor = new ConcurrentHashMap<>();

    private volatile boolean sealed;

    /**
     * @return true if this call created the entry, false if the visitor already had one
     */
    public boolean recordIfAbsent(String visitorId, ReferralKey referral) {
        if (sealed) {
            throw new IllegalStateException("Referral index is sealed");
        }
        ReferralKey existing = firstReferralByVisitor.putIfAbsent(visitorId, referral);
        if (existing != null) {
            log.debug("Ignoring later referral {} for visitor {} (first was {})", referral, visitorId, existing);
            return false;
        }
        return true;
    }

    /**
     * @return the first referral of the visitor, or null if the visitor never came from a search engine
     */
    public ReferralKey lookup(String visitorId) {
        return firstReferralByVisitor.get(visitorId);
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return firstReferralByVisitor.size();
    }
}
