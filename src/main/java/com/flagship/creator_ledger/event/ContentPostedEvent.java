package com.flagship.creator_ledger.event;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a creator posts content.
 */
@Value
public class ContentPostedEvent implements LedgerEvent {
    UUID eventId;
    ContentId contentId;
    Address creator;
    String contentHash;
    boolean premium;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContentPosted";

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

    public static ContentPostedEvent fromContent(Content content) {
        return new ContentPostedEvent(
            UUID.randomUUID(),
            content.getId(),
            content.getCreator(),
            content.getContentHash(),
            content.isPremium(),
            content.getTimestamp()
        );
    }
}
