package com.flagship.creator_ledger.outbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOutboxStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("Unpublished events come back in sequence order")
    void testFindUnpublished_Order() {
        InMemoryOutboxStore store = new InMemoryOutboxStore(clock);
        OutboxEvent first = store.append(event("a"));
        OutboxEvent second = store.append(event("b"));
        store.markPublished(first.getId());

        List<OutboxEvent> pending = store.findUnpublished(10);

        assertEquals(1, pending.size());
        assertEquals(second.getId(), pending.get(0).getId());
        assertEquals(2L, pending.get(0).getSequenceNumber());
        assertEquals(1L, store.countUnpublished());
    }

    @Test
    @DisplayName("Full store drops the oldest published event first")
    void testAppend_EvictsPublishedFirst() {
        InMemoryOutboxStore store = new InMemoryOutboxStore(clock, 3);
        OutboxEvent first = store.append(event("a"));
        OutboxEvent second = store.append(event("b"));
        store.append(event("c"));
        store.markPublished(second.getId());

        store.append(event("d"));

        assertEquals(3, store.size());
        assertTrue(store.findByAggregate("Content", "b").isEmpty());
        assertEquals(1, store.findByAggregate("Content", "a").size());
        assertEquals(1, store.findByAggregate("Content", "c").size());
        assertEquals(3L, store.countUnpublished());
        assertEquals(0L, store.getEvictedPendingCount());
        assertEquals(first.getId(), store.findUnpublished(1).get(0).getId());
    }

    @Test
    @DisplayName("Store with nothing published stays bounded by dropping the oldest pending event")
    void testAppend_NothingPublished() {
        InMemoryOutboxStore store = new InMemoryOutboxStore(clock, 2);

        for (int i = 0; i < 5; i++) {
            store.append(event("content-" + i));
        }

        assertEquals(2, store.size());
        assertEquals(3L, store.getEvictedPendingCount());
        List<OutboxEvent> pending = store.findUnpublished(10);
        assertEquals("content-3", pending.get(0).getAggregateId());
        assertEquals("content-4", pending.get(1).getAggregateId());
    }

    @Test
    @DisplayName("Retention limit must be positive")
    void testConstructor_InvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryOutboxStore(clock, 0));
    }

    private static OutboxEvent event(String contentId) {
        return OutboxEvent.create(UUID.randomUUID(), "Content", contentId, "ContentTipped", "{}", NOW);
    }
}
