package com.flagship.creator_ledger.outbox;

import java.util.List;
import java.util.UUID;

/**
 * Append-only event log plus the publishing bookkeeping.
 */
public interface OutboxStore {

    OutboxEvent append(OutboxEvent event);

    /**
     * Oldest unpublished events first.
     */
    List<OutboxEvent> findUnpublished(int limit);

    void markPublished(UUID eventId);

    /**
     * Increments the retry count and records the error.
     */
    void markFailed(UUID eventId, String errorMessage);

    long countUnpublished();

    List<OutboxEvent> findByAggregate(String aggregateType, String aggregateId);
}
