package com.flagship.creator_ledger.subscription;

import com.flagship.creator_ledger.creator.CreatorService;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.event.SubscribedEvent;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerCall;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.LedgerSettings;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Subscriptions from any address to a creator.
 *
 * Subscribing again replaces the record: the window restarts at the call's time
 * instead of being extended, and total_subscribers is incremented again.
 * total_subscribers therefore counts subscribe calls, not distinct subscribers.
 */
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final CreatorService creatorService;
    private final PaymentService paymentService;
    private final LedgerSettings settings;

    /**
     * Subscribes the caller to {@code creator} for one subscription period.
     *
     * @throws LedgerException NOT_A_CREATOR, SUBSCRIPTIONS_NOT_ENABLED or PAYMENT_FAILED
     */
    public Subscription subscribe(LedgerCall call, Address creator) {
        LedgerStore store = call.getStore();
        CreatorStats stats = creatorService.requireCreatorStats(store, creator);

        if (!stats.subscriptionsEnabled()) {
            throw new LedgerException(ErrorCode.SUBSCRIPTIONS_NOT_ENABLED,
                "Creator " + creator + " does not accept subscriptions");
        }

        paymentService.collect(call.getCaller(), creator, stats.getSubscriptionFee(), "subscription");

        Instant expiry = call.getNow().plus(settings.getSubscriptionPeriod());
        Subscription subscription = Subscription.activeUntil(call.getCaller(), creator, expiry);

        store.saveSubscription(subscription);
        store.saveStats(stats.recordSubscription());

        call.emit(SubscribedEvent.fromSubscription(subscription, call.getNow()));
        return subscription;
    }

    public Subscription findSubscription(LedgerStore store, Address subscriber, Address creator) {
        return store.findSubscription(subscriber, creator)
            .orElseGet(() -> Subscription.none(subscriber, creator));
    }

    /**
     * True while the pair has an active record whose expiry is strictly after {@code now}.
     */
    public boolean isSubscribed(LedgerStore store, Address subscriber, Address creator, Instant now) {
        return findSubscription(store, subscriber, creator).isActiveAt(now);
    }
}
