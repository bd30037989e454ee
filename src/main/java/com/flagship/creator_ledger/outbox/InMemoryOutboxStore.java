package com.flagship.creator_ledger.outbox;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Outbox kept on the heap, for the in-memory ledger runtime.
 *
 * Holds at most {@code maxRetained} events. When full, the oldest published event
 * is dropped first; with nothing published, the oldest pending one goes.
 */
@Slf4j
public class InMemoryOutboxStore implements OutboxStore {

    public static final int DEFAULT_MAX_RETAINED = 10_000;

    // Insertion order is sequence order
    private final Map<UUID, OutboxEvent> events = new LinkedHashMap<>();
    private final Clock clock;
    private final int maxRetained;
    private long sequence;
    private long evictedPending;

    public InMemoryOutboxStore(Clock clock) {
        this(clock, DEFAULT_MAX_RETAINED);
    }

    public InMemoryOutboxStore(Clock clock, int maxRetained) {
        if (maxRetained < 1) {
            throw new IllegalArgumentException("maxRetained must be positive: " + maxRetained);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxRetained = maxRetained;
    }

    @Override
    public synchronized OutboxEvent append(OutboxEvent event) {
        OutboxEvent sequenced = event.withSequenceNumber(++sequence);
        if (!events.containsKey(sequenced.getId()) && events.size() >= maxRetained) {
            evictOne();
        }
        events.put(sequenced.getId(), sequenced);
        return sequenced;
    }

    /**
     * Pending events dropped because the store was full.
     */
    public synchronized long getEvictedPendingCount() {
        return evictedPending;
    }

    public synchronized int size() {
        return events.size();
    }

    private void evictOne() {
        Iterator<OutboxEvent> it = events.values().iterator();
        while (it.hasNext()) {
            if (it.next().isPublished()) {
                it.remove();
                return;
            }
        }
        OutboxEvent oldest = events.values().iterator().next();
        events.remove(oldest.getId());
        evictedPending++;
        log.warn("In-memory outbox full ({} events), dropped unpublished event: id={}, type={}, sequence={}",
                maxRetained, oldest.getId(), oldest.getEventType(), oldest.getSequenceNumber());
    }

    @Override
    public synchronized List<OutboxEvent> findUnpublished(int limit) {
        return events.values().stream()
            .filter(event -> !event.isPublished())
            .sorted(Comparator.comparing(OutboxEvent::getSequenceNumber))
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized void markPublished(UUID eventId) {
        events.computeIfPresent(eventId, (id, event) -> event.markPublished(clock.instant()));
    }

    @Override
    public synchronized void markFailed(UUID eventId, String errorMessage) {
        events.computeIfPresent(eventId, (id, event) -> event.markRetry(errorMessage));
    }

    @Override
    public synchronized long countUnpublished() {
        return events.values().stream().filter(event -> !event.isPublished()).count();
    }

    @Override
    public synchronized List<OutboxEvent> findByAggregate(String aggregateType, String aggregateId) {
        List<OutboxEvent> result = new ArrayList<>();
        for (OutboxEvent event : events.values()) {
            if (event.getAggregateType().equals(aggregateType) && event.getAggregateId().equals(aggregateId)) {
                result.add(event);
            }
        }
        return result;
    }
}
