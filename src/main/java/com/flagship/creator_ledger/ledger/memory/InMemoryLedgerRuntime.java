package com.flagship.creator_ledger.ledger.memory;

import com.flagship.creator_ledger.ledger.AbstractLedgerRuntime;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runtime over an {@link InMemoryLedgerStore}.
 *
 * A fair lock gives every call exclusive access in arrival order. Writes go to a
 * {@link StagedLedgerStore} that is committed only when the call returns normally.
 */
@Slf4j
public class InMemoryLedgerRuntime extends AbstractLedgerRuntime {

    private final InMemoryLedgerStore store;
    private final ReentrantLock callLock = new ReentrantLock(true);

    public InMemoryLedgerRuntime(InMemoryLedgerStore store, Clock clock, OutboxService outboxService) {
        super(clock, outboxService);
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    protected <T> T inUnitOfWork(Function<LedgerStore, T> work) {
        callLock.lock();
        try {
            StagedLedgerStore staged = new StagedLedgerStore(store);
            T result = work.apply(staged);
            if (!staged.isEmpty()) {
                staged.commit();
            }
            return result;
        } catch (RuntimeException e) {
            log.debug("Discarding staged writes: {}", e.getMessage());
            throw e;
        } finally {
            callLock.unlock();
        }
    }

    @Override
    protected <T> T inReadOnlyUnit(Function<LedgerStore, T> work) {
        callLock.lock();
        try {
            return work.apply(store);
        } finally {
            callLock.unlock();
        }
    }
}
