package com.flagship.creator_ledger.ledger.jdbc;

import com.flagship.creator_ledger.ledger.AbstractLedgerRuntime;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.outbox.OutboxService;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runtime backed by PostgreSQL.
 *
 * Each call is one database transaction. The first statement locks the single
 * ledger_state row, which serializes mutating calls across every application
 * instance, so content-id allocation and counter updates follow one total order.
 * Any exception rolls the transaction back, outbox rows included.
 */
public class JdbcLedgerRuntime extends AbstractLedgerRuntime {

    private final JdbcLedgerStore store;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    public JdbcLedgerRuntime(JdbcLedgerStore store,
                             JdbcTemplate jdbcTemplate,
                             PlatformTransactionManager transactionManager,
                             Clock clock,
                             OutboxService outboxService) {
        super(clock, outboxService);
        this.store = Objects.requireNonNull(store, "store");
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    protected <T> T inUnitOfWork(Function<LedgerStore, T> work) {
        return writeTransaction.execute(status -> {
            jdbcTemplate.queryForObject("SELECT id FROM ledger_state WHERE id = 1 FOR UPDATE", Integer.class);
            return work.apply(store);
        });
    }

    @Override
    protected <T> T inReadOnlyUnit(Function<LedgerStore, T> work) {
        return readTransaction.execute(status -> work.apply(store));
    }
}
