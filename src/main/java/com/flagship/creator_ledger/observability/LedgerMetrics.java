package com.flagship.creator_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger calls and outbox publishing.
 *
 * Metrics exposed:
 * - ledger.operations: calls by operation and outcome (success or error code)
 * - ledger.operation.latency: call duration by operation
 * - outbox.event.published / publish_failed / dead_lettered: by event type
 * - outbox.backlog.size: unpublished events
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Ledger Calls ====================

    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordOperationLatency(String operation, Duration duration) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    // ==================== Outbox ====================

    public void recordEventPublished(String eventType) {
        registry.counter("outbox.event.published", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        registry.counter("outbox.event.publish_failed", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        registry.counter("outbox.event.dead_lettered", "event_type", sanitizeTag(eventType)).increment();
    }

    public void registerOutboxBacklogGauge(Supplier<Number> supplier) {
        registry.gauge("outbox.backlog.size", Tags.empty(), supplier, s -> s.get().doubleValue());
    }

    /**
     * Keeps tag values short and free of characters monitoring backends reject.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_.-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
