package com.flagship.creator_ledger.ledger;

import com.flagship.creator_ledger.event.LedgerEvent;
import com.flagship.creator_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Shared call handling for the runtimes.
 *
 * Subclasses supply the unit of work; this class binds the caller and the
 * clock reading to the call and writes the call's events to the outbox as the
 * last step of the unit of work, so a failed call leaves no events behind.
 */
@Slf4j
public abstract class AbstractLedgerRuntime implements LedgerRuntime {

    private final Clock clock;
    private final OutboxService outboxService;

    protected AbstractLedgerRuntime(Clock clock, OutboxService outboxService) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.outboxService = Objects.requireNonNull(outboxService, "outboxService");
    }

    @Override
    public <T> T execute(Address caller, Function<LedgerCall, T> work) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(work, "work");

        return inUnitOfWork(store -> {
            LedgerCall call = new LedgerCall(caller, clock.instant(), store);
            T result = work.apply(call);
            for (LedgerEvent event : call.getEvents()) {
                outboxService.saveEvent(event);
            }
            log.debug("Call by {} staged {} event(s)", caller, call.getEvents().size());
            return result;
        });
    }

    @Override
    public <T> T query(BiFunction<LedgerStore, Instant, T> reader) {
        Objects.requireNonNull(reader, "reader");
        return inReadOnlyUnit(store -> reader.apply(store, clock.instant()));
    }

    /**
     * Runs {@code work} against a store whose writes are committed only if it returns normally.
     */
    protected abstract <T> T inUnitOfWork(Function<LedgerStore, T> work);

    protected abstract <T> T inReadOnlyUnit(Function<LedgerStore, T> work);
}
