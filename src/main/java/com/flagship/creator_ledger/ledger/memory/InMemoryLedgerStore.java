package com.flagship.creator_ledger.ledger.memory;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.creator.CreatorProfile;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.subscription.Subscription;
import lombok.Value;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Heap-backed ledger tables.
 *
 * Not synchronized: {@link InMemoryLedgerRuntime} only touches it while holding its call lock,
 * and only through a {@link StagedLedgerStore} for mutating calls.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<Address, CreatorProfile> profiles = new HashMap<>();
    private final Map<Address, CreatorStats> stats = new HashMap<>();
    private final Map<ContentId, Content> contents = new HashMap<>();
    private final Map<SubscriptionKey, Subscription> subscriptions = new HashMap<>();
    private final Set<EngagementKey> engagementMarks = new HashSet<>();
    private final Map<Address, Long> engagementScores = new HashMap<>();
    private ContentId nextContentId = ContentId.of(0);

    @Override
    public Optional<CreatorProfile> findProfile(Address creator) {
        return Optional.ofNullable(profiles.get(creator));
    }

    @Override
    public void saveProfile(CreatorProfile profile) {
        profiles.put(profile.getCreator(), profile);
    }

    @Override
    public Optional<CreatorStats> findStats(Address creator) {
        return Optional.ofNullable(stats.get(creator));
    }

    @Override
    public void saveStats(CreatorStats creatorStats) {
        stats.put(creatorStats.getCreator(), creatorStats);
    }

    @Override
    public Optional<Content> findContent(ContentId id) {
        return Optional.ofNullable(contents.get(id));
    }

    @Override
    public void saveContent(Content content) {
        contents.put(content.getId(), content);
    }

    @Override
    public ContentId nextContentId() {
        return nextContentId;
    }

    @Override
    public void saveNextContentId(ContentId next) {
        this.nextContentId = next;
    }

    @Override
    public Optional<Subscription> findSubscription(Address subscriber, Address creator) {
        return Optional.ofNullable(subscriptions.get(new SubscriptionKey(subscriber, creator)));
    }

    @Override
    public void saveSubscription(Subscription subscription) {
        subscriptions.put(new SubscriptionKey(subscription.getSubscriber(), subscription.getCreator()), subscription);
    }

    @Override
    public boolean hasEngaged(ContentId contentId, Address user) {
        return engagementMarks.contains(new EngagementKey(contentId, user));
    }

    @Override
    public void markEngaged(ContentId contentId, Address user) {
        engagementMarks.add(new EngagementKey(contentId, user));
    }

    @Override
    public long userEngagementScore(Address user) {
        return engagementScores.getOrDefault(user, 0L);
    }

    @Override
    public void saveUserEngagementScore(Address user, long score) {
        engagementScores.put(user, score);
    }

    @Value
    static class SubscriptionKey {
        Address subscriber;
        Address creator;
    }

    @Value
    static class EngagementKey {
        ContentId contentId;
        Address user;
    }
}
