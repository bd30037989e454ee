package com.flagship.creator_ledger.event;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when content receives a tip. {@code amount} is the gross tip.
 */
@Value
public class ContentTippedEvent implements LedgerEvent {
    UUID eventId;
    ContentId contentId;
    Address tipper;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContentTipped";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return CONTENT_AGGREGATE;
    }

    @Override
    public String getAggregateId() {
        return contentId.toString();
    }

    public static ContentTippedEvent of(ContentId contentId, Address tipper, BigInteger amount, Instant occurredAt) {
        return new ContentTippedEvent(UUID.randomUUID(), contentId, tipper, amount, occurredAt);
    }
}
