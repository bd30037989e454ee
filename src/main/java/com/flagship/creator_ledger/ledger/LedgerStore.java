package com.flagship.creator_ledger.ledger;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.creator.CreatorProfile;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.subscription.Subscription;

import java.util.Optional;

/**
 * Typed access to the ledger tables.
 *
 * Implementations are not required to be thread-safe or atomic on their own:
 * a {@link LedgerRuntime} hands a store to exactly one call at a time and
 * decides whether its writes are committed.
 */
public interface LedgerStore {

    Optional<CreatorProfile> findProfile(Address creator);

    void saveProfile(CreatorProfile profile);

    Optional<CreatorStats> findStats(Address creator);

    void saveStats(CreatorStats stats);

    Optional<Content> findContent(ContentId id);

    void saveContent(Content content);

    /**
     * The id the next posted content will receive; equals the number of posts so far.
     */
    ContentId nextContentId();

    void saveNextContentId(ContentId next);

    Optional<Subscription> findSubscription(Address subscriber, Address creator);

    void saveSubscription(Subscription subscription);

    boolean hasEngaged(ContentId contentId, Address user);

    void markEngaged(ContentId contentId, Address user);

    long userEngagementScore(Address user);

    void saveUserEngagementScore(Address user, long score);
}
