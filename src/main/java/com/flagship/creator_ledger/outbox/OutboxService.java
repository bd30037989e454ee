package com.flagship.creator_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.creator_ledger.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox.
 *
 * Called by the ledger runtime inside a call's unit of work, after the call's
 * own logic has succeeded. Events are not sent to Kafka here; that is the job of
 * {@link OutboxPublisher}.
 */
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxStore store;
    private final ObjectMapper objectMapper;

    /**
     * Serializes and appends an event.
     *
     * @param event event emitted by a ledger call
     * @return the stored outbox record
     */
    public OutboxEvent saveEvent(LedgerEvent event) {
        String jsonPayload = serializePayload(event);

        OutboxEvent outboxEvent = OutboxEvent.create(
            event.getEventId(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            jsonPayload,
            event.getOccurredAt()
        );
        OutboxEvent saved = store.append(outboxEvent);

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return saved;
    }

    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return store.findUnpublished(limit);
    }

    public void markPublished(UUID eventId) {
        store.markPublished(eventId);
        log.debug("Marked event {} as published", eventId);
    }

    public void markFailed(UUID eventId, String errorMessage) {
        store.markFailed(eventId, errorMessage);
        log.warn("Marked event {} as failed: {}", eventId, errorMessage);
    }

    /**
     * Events for one creator or content, oldest first (for auditing).
     */
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, String aggregateId) {
        return store.findByAggregate(aggregateType, aggregateId);
    }

    public long countUnpublished() {
        return store.countUnpublished();
    }

    private String serializePayload(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload: " + event.getEventType(), e);
        }
    }
}
