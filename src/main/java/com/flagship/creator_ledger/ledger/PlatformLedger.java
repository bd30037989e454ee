package com.flagship.creator_ledger.ledger;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.content.ContentService;
import com.flagship.creator_ledger.creator.CreatorProfile;
import com.flagship.creator_ledger.creator.CreatorService;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.engagement.EngagementService;
import com.flagship.creator_ledger.observability.LedgerMetrics;
import com.flagship.creator_ledger.subscription.Subscription;
import com.flagship.creator_ledger.subscription.SubscriptionService;
import com.flagship.creator_ledger.tipping.TipService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.function.Function;

/**
 * Entry point of the creator ledger.
 *
 * Every mutating operation runs as one call on the {@link LedgerRuntime}: all
 * preconditions are checked before the first write, and a rejected call leaves
 * neither state changes nor events. Reads go through {@link LedgerRuntime#query}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlatformLedger {

    private final LedgerRuntime runtime;
    private final CreatorService creatorService;
    private final ContentService contentService;
    private final SubscriptionService subscriptionService;
    private final TipService tipService;
    private final EngagementService engagementService;
    private final LedgerSettings settings;
    private final LedgerMetrics metrics;

    // ==================== Mutations ====================

    public CreatorProfile register(Address caller, String profileData) {
        return perform("register", caller, call -> creatorService.register(call, profileData));
    }

    public CreatorStats setSubscriptionFee(Address caller, BigInteger fee) {
        return perform("set_subscription_fee", caller, call -> creatorService.setSubscriptionFee(call, fee));
    }

    public Content postContent(Address caller, String contentHash, boolean premium, boolean tipEnabled) {
        return perform("post_content", caller,
            call -> contentService.post(call, contentHash, premium, tipEnabled));
    }

    public Subscription subscribe(Address caller, Address creator) {
        return perform("subscribe", caller, call -> subscriptionService.subscribe(call, creator));
    }

    public Content tip(Address caller, ContentId contentId, BigInteger amount) {
        return perform("tip", caller, call -> tipService.tip(call, contentId, amount));
    }

    public Content engage(Address caller, ContentId contentId, String engagementType) {
        return perform("engage", caller, call -> engagementService.engage(call, contentId, engagementType));
    }

    // ==================== Reads ====================

    /**
     * Zero-valued stats for addresses that never registered.
     */
    public CreatorStats creatorStats(Address creator) {
        return runtime.query((store, now) -> creatorService.statsOf(store, creator));
    }

    /**
     * @throws LedgerException NOT_FOUND if the address never registered
     */
    public CreatorProfile creatorProfile(Address creator) {
        return runtime.query((store, now) -> store.findProfile(creator))
            .orElseThrow(() -> new LedgerException(ErrorCode.NOT_FOUND,
                "Address " + creator + " is not a registered creator"));
    }

    public boolean isCreator(Address address) {
        return runtime.query((store, now) -> store.findProfile(address).isPresent());
    }

    /**
     * @throws LedgerException NOT_FOUND for ids that were never assigned
     */
    public Content content(ContentId id) {
        return runtime.query((store, now) -> contentService.requireContent(store, id));
    }

    /**
     * Number of content records so far, which is also the next id to be assigned.
     */
    public long contentCount() {
        return runtime.query((store, now) -> store.nextContentId().getValue());
    }

    public long userEngagementScore(Address user) {
        return runtime.query((store, now) -> engagementService.userEngagementScore(store, user));
    }

    public boolean isSubscribed(Address user, Address creator) {
        return runtime.query((store, now) -> subscriptionService.isSubscribed(store, user, creator, now));
    }

    /**
     * The stored record, or an inactive placeholder; expiry is not evaluated here.
     */
    public Subscription subscription(Address user, Address creator) {
        return runtime.query((store, now) -> subscriptionService.findSubscription(store, user, creator));
    }

    public LedgerSettings settings() {
        return settings;
    }

    private <T> T perform(String operation, Address caller, Function<LedgerCall, T> work) {
        long startTime = System.currentTimeMillis();
        try {
            T result = runtime.execute(caller, work);
            metrics.recordOperation(operation, "success");
            log.info("Ledger call succeeded: operation={}, caller={}", operation, caller);
            return result;
        } catch (LedgerException e) {
            metrics.recordOperation(operation, e.getErrorCode().name());
            log.warn("Ledger call rejected: operation={}, caller={}, code={}, reason={}",
                    operation, caller, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            metrics.recordOperation(operation, "invalid_argument");
            log.warn("Ledger call refused: operation={}, caller={}, reason={}", operation, caller, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("Ledger call failed: operation={}, caller={}", operation, caller, e);
            throw e;
        } finally {
            metrics.recordOperationLatency(operation, Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
    }
}
