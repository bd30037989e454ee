package com.flagship.creator_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification emitted by a successful mutating call.
 *
 * Events are facts: they are written to the outbox in the same unit of work
 * as the state change and are never read back by the ledger.
 */
public interface LedgerEvent {

    String CREATOR_AGGREGATE = "Creator";
    String CONTENT_AGGREGATE = "Content";

    /**
     * Unique identifier for this event instance.
     * Used for deduplication by consumers.
     */
    UUID getEventId();

    /**
     * Aggregate the event belongs to, either {@link #CREATOR_AGGREGATE} or {@link #CONTENT_AGGREGATE}.
     */
    String getAggregateType();

    /**
     * Creator address or content id; also the Kafka record key.
     */
    String getAggregateId();

    /**
     * The call's time as supplied by the runtime.
     */
    Instant getOccurredAt();

    String getEventType();
}
