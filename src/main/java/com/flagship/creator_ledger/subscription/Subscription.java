package com.flagship.creator_ledger.subscription;

import com.flagship.creator_ledger.ledger.Address;
import lombok.Value;

import java.time.Instant;

/**
 * Subscription of {@code subscriber} to {@code creator}.
 * Expiry is evaluated lazily; nothing sweeps expired records.
 */
@Value
public class Subscription {
    Address subscriber;
    Address creator;
    boolean active;
    Instant expiry;

    /**
     * Record returned when the pair has never subscribed.
     */
    public static Subscription none(Address subscriber, Address creator) {
        return new Subscription(subscriber, creator, false, null);
    }

    public static Subscription activeUntil(Address subscriber, Address creator, Instant expiry) {
        return new Subscription(subscriber, creator, true, expiry);
    }

    /**
     * Active at {@code now} only while the expiry is strictly in the future.
     */
    public boolean isActiveAt(Instant now) {
        return active && expiry != null && expiry.isAfter(now);
    }
}
