package com.flagship.creator_ledger.creator;

import com.flagship.creator_ledger.ledger.Address;
import lombok.Value;

import java.math.BigInteger;

/**
 * Aggregate counters of a creator, co-created with the profile.
 *
 * Transitions return a new instance, the ledger store decides when it becomes visible.
 * {@code subscriptionFee == 0} means subscriptions are disabled.
 * {@code engagementScore} is reserved and stays at zero.
 */
@Value
public class CreatorStats {
    Address creator;
    long totalSubscribers;
    long totalContent;
    BigInteger totalTipsReceived;
    BigInteger subscriptionFee;
    long engagementScore;

    /**
     * Zero-valued stats, used both at registration and for unknown addresses.
     */
    public static CreatorStats empty(Address creator) {
        return new CreatorStats(creator, 0L, 0L, BigInteger.ZERO, BigInteger.ZERO, 0L);
    }

    public boolean subscriptionsEnabled() {
        return subscriptionFee.signum() > 0;
    }

    public CreatorStats withSubscriptionFee(BigInteger fee) {
        if (fee == null || fee.signum() < 0) {
            throw new IllegalArgumentException("Subscription fee must not be negative");
        }
        return new CreatorStats(creator, totalSubscribers, totalContent, totalTipsReceived, fee, engagementScore);
    }

    public CreatorStats recordContentPosted() {
        return new CreatorStats(creator, totalSubscribers, Math.addExact(totalContent, 1L),
            totalTipsReceived, subscriptionFee, engagementScore);
    }

    /**
     * Counts a subscription event. Re-subscriptions are counted again.
     */
    public CreatorStats recordSubscription() {
        return new CreatorStats(creator, Math.addExact(totalSubscribers, 1L), totalContent,
            totalTipsReceived, subscriptionFee, engagementScore);
    }

    public CreatorStats recordTip(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Tip amount must be positive");
        }
        return new CreatorStats(creator, totalSubscribers, totalContent,
            totalTipsReceived.add(amount), subscriptionFee, engagementScore);
    }
}
