package com.flagship.creator_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting to be published, or already published, to Kafka.
 *
 * Written in the same unit of work as the state change it describes,
 * then picked up by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Creator" or "Content"
    String aggregateId;        // creator address or content id
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the store

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(UUID id, String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public OutboxEvent withSequenceNumber(long sequence) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            publishedAt, retryCount, lastError, sequence);
    }

    public OutboxEvent markPublished(Instant at) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            at, retryCount, null, sequenceNumber);
    }

    public OutboxEvent markRetry(String errorMessage) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            publishedAt, retryCount + 1, errorMessage, sequenceNumber);
    }
}
