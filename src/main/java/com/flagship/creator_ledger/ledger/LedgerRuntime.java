package com.flagship.creator_ledger.ledger;

import java.time.Instant;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Executes ledger calls one at a time, all-or-nothing.
 *
 * Calls are applied in a single total order. If {@code work} throws, none of
 * its writes and none of its events become visible.
 */
public interface LedgerRuntime {

    <T> T execute(Address caller, Function<LedgerCall, T> work);

    /**
     * Side-effect-free read against committed state at the runtime's current time.
     */
    <T> T query(BiFunction<LedgerStore, Instant, T> reader);
}
