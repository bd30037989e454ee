package com.flagship.creator_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.LedgerRuntime;
import com.flagship.creator_ledger.ledger.LedgerSettings;
import com.flagship.creator_ledger.ledger.jdbc.JdbcLedgerRuntime;
import com.flagship.creator_ledger.ledger.jdbc.JdbcLedgerStore;
import com.flagship.creator_ledger.ledger.memory.InMemoryLedgerRuntime;
import com.flagship.creator_ledger.ledger.memory.InMemoryLedgerStore;
import com.flagship.creator_ledger.observability.LedgerMetrics;
import com.flagship.creator_ledger.outbox.InMemoryOutboxStore;
import com.flagship.creator_ledger.outbox.JdbcOutboxStore;
import com.flagship.creator_ledger.outbox.OutboxService;
import com.flagship.creator_ledger.outbox.OutboxStore;
import com.flagship.creator_ledger.payment.NoOpPaymentGateway;
import com.flagship.creator_ledger.payment.PaymentGateway;
import com.flagship.creator_ledger.payment.PlatformFee;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;

/**
 * Ledger initialization.
 *
 * Reads the fixed parameters (payment token, platform fee, treasury, subscription
 * period) once and wires the runtime selected by {@code ledger.store}:
 * {@code jdbc} (default) or {@code memory}.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fails startup with FEE_TOO_HIGH when the platform fee exceeds 1000 basis points.
     */
    @Bean
    public LedgerSettings ledgerSettings(
            @Value("${ledger.payment-token}") String paymentToken,
            @Value("${ledger.platform-fee-bps:0}") int platformFeeBps,
            @Value("${ledger.treasury-address}") String treasury,
            @Value("${ledger.subscription-period:P30D}") Duration subscriptionPeriod) {
        LedgerSettings settings = new LedgerSettings(
            paymentToken,
            PlatformFee.ofBasisPoints(platformFeeBps),
            Address.of(treasury),
            subscriptionPeriod
        );
        log.info("Ledger initialized: paymentToken={}, platformFeeBps={}, treasury={}, subscriptionPeriod={}",
                paymentToken, platformFeeBps, treasury, subscriptionPeriod);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean(PaymentGateway.class)
    public PaymentGateway paymentGateway(LedgerSettings settings) {
        return new NoOpPaymentGateway(settings.getPaymentToken());
    }

    @Bean
    public OutboxService outboxService(OutboxStore outboxStore, ObjectMapper objectMapper, LedgerMetrics metrics) {
        OutboxService outboxService = new OutboxService(outboxStore, objectMapper);
        metrics.registerOutboxBacklogGauge(outboxService::countUnpublished);
        return outboxService;
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.store", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStoreConfig {

        @Bean
        public JdbcLedgerStore jdbcLedgerStore(JdbcTemplate jdbcTemplate) {
            return new JdbcLedgerStore(jdbcTemplate);
        }

        @Bean
        public OutboxStore outboxStore(JdbcTemplate jdbcTemplate, Clock clock) {
            return new JdbcOutboxStore(jdbcTemplate, clock);
        }

        @Bean
        public LedgerRuntime ledgerRuntime(JdbcLedgerStore store,
                                           JdbcTemplate jdbcTemplate,
                                           PlatformTransactionManager transactionManager,
                                           Clock clock,
                                           OutboxService outboxService) {
            return new JdbcLedgerRuntime(store, jdbcTemplate, transactionManager, clock, outboxService);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.store", havingValue = "memory")
    static class InMemoryStoreConfig {

        @Bean
        public InMemoryLedgerStore inMemoryLedgerStore() {
            return new InMemoryLedgerStore();
        }

        @Bean
        public OutboxStore outboxStore(Clock clock,
                @Value("${outbox.memory.max-retained:" + InMemoryOutboxStore.DEFAULT_MAX_RETAINED + "}")
                int maxRetained) {
            return new InMemoryOutboxStore(clock, maxRetained);
        }

        @Bean
        public LedgerRuntime ledgerRuntime(InMemoryLedgerStore store, Clock clock, OutboxService outboxService) {
            return new InMemoryLedgerRuntime(store, clock, outboxService);
        }
    }
}
