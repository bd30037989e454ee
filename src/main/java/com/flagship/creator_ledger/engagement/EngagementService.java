package com.flagship.creator_ledger.engagement;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.content.ContentService;
import com.flagship.creator_ledger.event.ContentEngagedEvent;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerCall;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.subscription.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Engagement signals on content.
 *
 * At most one engagement per (content, user) for the lifetime of the ledger.
 * Premium content needs an active subscription to its creator at the time of the call.
 */
@Service
@RequiredArgsConstructor
public class EngagementService {

    private final ContentService contentService;
    private final SubscriptionService subscriptionService;

    /**
     * @param engagementType opaque tag such as "LIKE"; not interpreted, may be empty
     * @throws LedgerException NOT_FOUND, ALREADY_ENGAGED or NOT_SUBSCRIBED
     */
    public Content engage(LedgerCall call, ContentId contentId, String engagementType) {
        if (engagementType == null) {
            throw new IllegalArgumentException("Engagement type is required");
        }
        LedgerStore store = call.getStore();
        Address user = call.getCaller();
        Content content = contentService.requireContent(store, contentId);

        if (store.hasEngaged(contentId, user)) {
            throw new LedgerException(ErrorCode.ALREADY_ENGAGED,
                "Address " + user + " already engaged with content " + contentId);
        }
        if (content.isPremium()
                && !subscriptionService.isSubscribed(store, user, content.getCreator(), call.getNow())) {
            throw new LedgerException(ErrorCode.NOT_SUBSCRIBED,
                "Content " + contentId + " is premium and " + user + " has no active subscription");
        }

        Content engaged = content.recordEngagement();
        store.markEngaged(contentId, user);
        store.saveContent(engaged);
        store.saveUserEngagementScore(user, Math.addExact(store.userEngagementScore(user), 1L));

        call.emit(ContentEngagedEvent.of(contentId, user, engagementType, call.getNow()));
        return engaged;
    }

    public long userEngagementScore(LedgerStore store, Address user) {
        return store.userEngagementScore(user);
    }
}
