package com.flagship.creator_ledger.event;

import com.flagship.creator_ledger.ledger.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a creator changes the subscription fee.
 * A fee of zero means subscriptions were switched off.
 */
@Value
public class SubscriptionFeeUpdatedEvent implements LedgerEvent {
    UUID eventId;
    Address creator;
    BigInteger subscriptionFee;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubscriptionFeeUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return CREATOR_AGGREGATE;
    }

    @Override
    public String getAggregateId() {
        return creator.getValue();
    }

    public static SubscriptionFeeUpdatedEvent of(Address creator, BigInteger fee, Instant occurredAt) {
        return new SubscriptionFeeUpdatedEvent(UUID.randomUUID(), creator, fee, occurredAt);
    }
}
