package com.flagship.creator_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger events. Skipped when outbox publishing is off.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.events:ledger.events}")
    private String eventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Created if missing. Records are keyed by aggregate id, so more partitions
     * only spread creators and contents, never reorder one aggregate.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
