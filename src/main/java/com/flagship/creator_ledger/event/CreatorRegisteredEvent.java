package com.flagship.creator_ledger.event;

import com.flagship.creator_ledger.ledger.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when an address registers as a creator.
 */
@Value
public class CreatorRegisteredEvent implements LedgerEvent {
    UUID eventId;
    Address creator;
    String profileData;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreatorRegistered";

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

    public static CreatorRegisteredEvent of(Address creator, String profileData, Instant occurredAt) {
        return new CreatorRegisteredEvent(UUID.randomUUID(), creator, profileData, occurredAt);
    }
}
