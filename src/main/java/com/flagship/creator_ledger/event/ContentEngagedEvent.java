package com.flagship.creator_ledger.event;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published the first and only time a user engages with a piece of content.
 */
@Value
public class ContentEngagedEvent implements LedgerEvent {
    UUID eventId;
    ContentId contentId;
    Address user;
    String engagementType;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContentEngaged";

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

    public static ContentEngagedEvent of(ContentId contentId, Address user, String engagementType, Instant occurredAt) {
        return new ContentEngagedEvent(UUID.randomUUID(), contentId, user, engagementType, occurredAt);
    }
}
