package com.flagship.creator_ledger.outbox;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * PostgreSQL outbox. Appends join the caller's transaction, so an event row
 * exists if and only if the ledger call that produced it committed.
 */
public class JdbcOutboxStore implements OutboxStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcOutboxStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public OutboxEvent append(OutboxEvent event) {
        Long sequence = jdbcTemplate.queryForObject(
            "INSERT INTO outbox_events (id, aggregate_type, aggregate_id, event_type, payload, created_at, retry_count) " +
            "VALUES (?, ?, ?, ?, ?, ?, 0) RETURNING sequence_number",
            Long.class,
            event.getId(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            event.getPayload(),
            Timestamp.from(event.getCreatedAt())
        );
        return sequence != null ? event.withSequenceNumber(sequence) : event;
    }

    /**
     * SKIP LOCKED only passes over rows still locked by an in-flight ledger transaction.
     * The rows are not locked for the whole publish loop (the query runs in its own
     * autocommit statement), so two publishers may send the same event and delivery
     * is at-least-once. Consumers deduplicate on the event id.
     */
    @Override
    public List<OutboxEvent> findUnpublished(int limit) {
        return jdbcTemplate.query(
            "SELECT id, aggregate_type, aggregate_id, event_type, payload, created_at, published_at, " +
            "retry_count, last_error, sequence_number FROM outbox_events " +
            "WHERE published_at IS NULL ORDER BY sequence_number LIMIT ? FOR UPDATE SKIP LOCKED",
            outboxEventRowMapper(),
            limit
        );
    }

    @Override
    public void markPublished(UUID eventId) {
        jdbcTemplate.update(
            "UPDATE outbox_events SET published_at = ?, last_error = NULL WHERE id = ?",
            Timestamp.from(clock.instant()),
            eventId
        );
    }

    @Override
    public void markFailed(UUID eventId, String errorMessage) {
        jdbcTemplate.update(
            "UPDATE outbox_events SET retry_count = retry_count + 1, last_error = ? WHERE id = ?",
            errorMessage,
            eventId
        );
    }

    @Override
    public long countUnpublished() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE published_at IS NULL", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<OutboxEvent> findByAggregate(String aggregateType, String aggregateId) {
        return jdbcTemplate.query(
            "SELECT id, aggregate_type, aggregate_id, event_type, payload, created_at, published_at, " +
            "retry_count, last_error, sequence_number FROM outbox_events " +
            "WHERE aggregate_type = ? AND aggregate_id = ? ORDER BY sequence_number",
            outboxEventRowMapper(),
            aggregateType,
            aggregateId
        );
    }

    private RowMapper<OutboxEvent> outboxEventRowMapper() {
        return (rs, rowNum) -> {
            Timestamp publishedAt = rs.getTimestamp("published_at");
            return new OutboxEvent(
                UUID.fromString(rs.getString("id")),
                rs.getString("aggregate_type"),
                rs.getString("aggregate_id"),
                rs.getString("event_type"),
                rs.getString("payload"),
                rs.getTimestamp("created_at").toInstant(),
                publishedAt != null ? publishedAt.toInstant() : null,
                rs.getInt("retry_count"),
                rs.getString("last_error"),
                rs.getLong("sequence_number")
            );
        };
    }
}
