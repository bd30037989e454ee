package com.flagship.creator_ledger.content;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A published content record.
 *
 * Only {@code totalTips} and {@code totalEngagements} change after creation,
 * and both only grow.
 */
@Value
public class Content {
    ContentId id;
    Address creator;
    String contentHash;
    Instant timestamp;
    boolean premium;
    boolean tipEnabled;
    BigInteger totalTips;
    long totalEngagements;

    public static Content post(ContentId id, Address creator, String contentHash, Instant timestamp,
                               boolean premium, boolean tipEnabled) {
        return new Content(id, creator, contentHash, timestamp, premium, tipEnabled, BigInteger.ZERO, 0L);
    }

    public Content recordTip(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Tip amount must be positive");
        }
        return new Content(id, creator, contentHash, timestamp, premium, tipEnabled,
            totalTips.add(amount), totalEngagements);
    }

    public Content recordEngagement() {
        return new Content(id, creator, contentHash, timestamp, premium, tipEnabled,
            totalTips, Math.addExact(totalEngagements, 1L));
    }
}
