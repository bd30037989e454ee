package com.flagship.creator_ledger.ledger;

import com.flagship.creator_ledger.event.LedgerEvent;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One mutating call as presented by the runtime: the authenticated caller,
 * the call's time, the store view the call may read and write, and the
 * notifications it wants to emit if it succeeds.
 */
@Getter
public class LedgerCall {

    private final Address caller;
    private final Instant now;
    private final LedgerStore store;
    private final List<LedgerEvent> events = new ArrayList<>();

    public LedgerCall(Address caller, Instant now, LedgerStore store) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.now = Objects.requireNonNull(now, "now");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Queues a notification. It only leaves the call if the call commits.
     */
    public void emit(LedgerEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    public List<LedgerEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }
}
