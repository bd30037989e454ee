package com.flagship.creator_ledger.outbox;

import com.flagship.creator_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background publisher that reads ledger events from the outbox and sends them to Kafka.
 *
 * Delivery is fire-and-forget from the ledger's point of view: a failed send
 * only bumps the event's retry count, it never touches ledger state.
 * The aggregate id (creator address or content id) is the record key, so events
 * of one aggregate stay ordered within a partition. Delivery is at-least-once: an
 * event is marked published only after the broker ack, so a failure in between
 * sends it again on the next poll.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final LedgerMetrics ledgerMetrics;

    @Value("${kafka.topic.events:ledger.events}")
    private String eventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), leaving it for manual replay. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            ledgerMetrics.recordEventDeadLettered(event.getEventType());
            return;
        }

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(eventsTopic, event.getAggregateId(), event.getPayload());

            // Wait for the ack so events of one aggregate go out in order
            SendResult<String, String> result = future.get();

            if (result != null && result.getRecordMetadata() != null) {
                log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                        event.getId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset(),
                        event.getEventType());
            }

            outboxService.markPublished(event.getId());
            ledgerMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            ledgerMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            ledgerMetrics.recordEventPublishFailed(event.getEventType());
        }
    }

    /**
     * Manually triggers publishing (useful for testing).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    public long getUnpublishedCount() {
        return outboxService.countUnpublished();
    }
}
