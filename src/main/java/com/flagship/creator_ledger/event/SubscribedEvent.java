package com.flagship.creator_ledger.event;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.subscription.Subscription;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published on every successful subscribe call, re-subscriptions included.
 */
@Value
public class SubscribedEvent implements LedgerEvent {
    UUID eventId;
    Address subscriber;
    Address creator;
    Instant expiry;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Subscribed";

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

    public static SubscribedEvent fromSubscription(Subscription subscription, Instant occurredAt) {
        return new SubscribedEvent(
            UUID.randomUUID(),
            subscription.getSubscriber(),
            subscription.getCreator(),
            subscription.getExpiry(),
            occurredAt
        );
    }
}
