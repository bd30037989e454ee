package com.flagship.creator_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.creator_ledger.config.JacksonConfig;
import com.flagship.creator_ledger.event.ContentTippedEvent;
import com.flagship.creator_ledger.event.CreatorRegisteredEvent;
import com.flagship.creator_ledger.event.LedgerEvent;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes, ordering and publish bookkeeping.
 */
class OutboxServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        outboxService = new OutboxService(new InMemoryOutboxStore(new MutableClock(NOW)), objectMapper);
    }

    @Test
    @DisplayName("Saved event keeps its id, aggregate and JSON payload")
    void testSaveEvent() throws Exception {
        ContentTippedEvent event = ContentTippedEvent.of(ContentId.of(3), Address.of("fan"),
            BigInteger.TWO.pow(80), NOW);

        OutboxEvent saved = outboxService.saveEvent(event);

        assertEquals(event.getEventId(), saved.getId());
        assertEquals(LedgerEvent.CONTENT_AGGREGATE, saved.getAggregateType());
        assertEquals("3", saved.getAggregateId());
        assertEquals(ContentTippedEvent.EVENT_TYPE, saved.getEventType());
        assertEquals(NOW, saved.getCreatedAt());
        assertFalse(saved.isPublished());

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertEquals(3L, payload.get("contentId").asLong());
        assertEquals("fan", payload.get("tipper").asText());
        assertEquals(BigInteger.TWO.pow(80), payload.get("amount").bigIntegerValue());
        assertEquals("2024-03-01T12:00:00Z", payload.get("occurredAt").asText());
    }

    @Test
    @DisplayName("Unpublished events come back in append order")
    void testFindUnpublished_Order() {
        OutboxEvent first = outboxService.saveEvent(CreatorRegisteredEvent.of(Address.of("a"), "a", NOW));
        OutboxEvent second = outboxService.saveEvent(CreatorRegisteredEvent.of(Address.of("b"), "b", NOW));
        OutboxEvent third = outboxService.saveEvent(CreatorRegisteredEvent.of(Address.of("c"), "c", NOW));

        List<OutboxEvent> batch = outboxService.findUnpublishedEvents(2);

        assertEquals(2, batch.size());
        assertEquals(first.getId(), batch.get(0).getId());
        assertEquals(second.getId(), batch.get(1).getId());
        assertTrue(third.getSequenceNumber() > second.getSequenceNumber());
    }

    @Test
    @DisplayName("Published events leave the backlog, failed ones count retries")
    void testMarkPublishedAndFailed() {
        OutboxEvent published = outboxService.saveEvent(CreatorRegisteredEvent.of(Address.of("a"), "a", NOW));
        OutboxEvent failed = outboxService.saveEvent(CreatorRegisteredEvent.of(Address.of("b"), "b", NOW));

        outboxService.markPublished(published.getId());
        outboxService.markFailed(failed.getId(), "broker down");

        assertEquals(1L, outboxService.countUnpublished());
        OutboxEvent retried = outboxService.findUnpublishedEvents(10).get(0);
        assertEquals(failed.getId(), retried.getId());
        assertEquals(1, retried.getRetryCount());
        assertEquals("broker down", retried.getLastError());

        OutboxEvent done = outboxService.getEventsForAggregate(LedgerEvent.CREATOR_AGGREGATE, "a").get(0);
        assertEquals(NOW, done.getPublishedAt());
    }
}
