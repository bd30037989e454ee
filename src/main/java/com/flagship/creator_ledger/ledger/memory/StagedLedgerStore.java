package com.flagship.creator_ledger.ledger.memory;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.creator.CreatorProfile;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.ledger.memory.InMemoryLedgerStore.EngagementKey;
import com.flagship.creator_ledger.ledger.memory.InMemoryLedgerStore.SubscriptionKey;
import com.flagship.creator_ledger.subscription.Subscription;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Write buffer over a backing store.
 *
 * Reads see the call's own writes first, then the backing store. Nothing reaches
 * the backing store until {@link #commit()}; dropping the instance discards the call.
 */
class StagedLedgerStore implements LedgerStore {

    private final LedgerStore base;

    private final Map<Address, CreatorProfile> profiles = new HashMap<>();
    private final Map<Address, CreatorStats> stats = new HashMap<>();
    private final Map<ContentId, Content> contents = new HashMap<>();
    private final Map<SubscriptionKey, Subscription> subscriptions = new HashMap<>();
    private final Set<EngagementKey> engagementMarks = new HashSet<>();
    private final Map<Address, Long> engagementScores = new HashMap<>();
    private ContentId nextContentId;

    StagedLedgerStore(LedgerStore base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    @Override
    public Optional<CreatorProfile> findProfile(Address creator) {
        CreatorProfile staged = profiles.get(creator);
        return staged != null ? Optional.of(staged) : base.findProfile(creator);
    }

    @Override
    public void saveProfile(CreatorProfile profile) {
        profiles.put(profile.getCreator(), profile);
    }

    @Override
    public Optional<CreatorStats> findStats(Address creator) {
        CreatorStats staged = stats.get(creator);
        return staged != null ? Optional.of(staged) : base.findStats(creator);
    }

    @Override
    public void saveStats(CreatorStats creatorStats) {
        stats.put(creatorStats.getCreator(), creatorStats);
    }

    @Override
    public Optional<Content> findContent(ContentId id) {
        Content staged = contents.get(id);
        return staged != null ? Optional.of(staged) : base.findContent(id);
    }

    @Override
    public void saveContent(Content content) {
        contents.put(content.getId(), content);
    }

    @Override
    public ContentId nextContentId() {
        return nextContentId != null ? nextContentId : base.nextContentId();
    }

    @Override
    public void saveNextContentId(ContentId next) {
        this.nextContentId = next;
    }

    @Override
    public Optional<Subscription> findSubscription(Address subscriber, Address creator) {
        Subscription staged = subscriptions.get(new SubscriptionKey(subscriber, creator));
        return staged != null ? Optional.of(staged) : base.findSubscription(subscriber, creator);
    }

    @Override
    public void saveSubscription(Subscription subscription) {
        subscriptions.put(new SubscriptionKey(subscription.getSubscriber(), subscription.getCreator()), subscription);
    }

    @Override
    public boolean hasEngaged(ContentId contentId, Address user) {
        return engagementMarks.contains(new EngagementKey(contentId, user)) || base.hasEngaged(contentId, user);
    }

    @Override
    public void markEngaged(ContentId contentId, Address user) {
        engagementMarks.add(new EngagementKey(contentId, user));
    }

    @Override
    public long userEngagementScore(Address user) {
        Long staged = engagementScores.get(user);
        return staged != null ? staged : base.userEngagementScore(user);
    }

    @Override
    public void saveUserEngagementScore(Address user, long score) {
        engagementScores.put(user, score);
    }

    /**
     * Copies every staged write into the backing store.
     */
    void commit() {
        profiles.values().forEach(base::saveProfile);
        stats.values().forEach(base::saveStats);
        contents.values().forEach(base::saveContent);
        subscriptions.values().forEach(base::saveSubscription);
        engagementMarks.forEach(mark -> base.markEngaged(mark.getContentId(), mark.getUser()));
        engagementScores.forEach(base::saveUserEngagementScore);
        if (nextContentId != null) {
            base.saveNextContentId(nextContentId);
        }
    }

    boolean isEmpty() {
        return profiles.isEmpty() && stats.isEmpty() && contents.isEmpty() && subscriptions.isEmpty()
            && engagementMarks.isEmpty() && engagementScores.isEmpty() && nextContentId == null;
    }
}
