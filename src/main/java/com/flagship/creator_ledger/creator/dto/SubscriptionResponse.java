package com.flagship.creator_ledger.creator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.creator_ledger.subscription.Subscription;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Stored subscription record plus the evaluated {@code subscribed} flag.
 * {@code active} alone says nothing about expiry.
 */
@Value
@Builder
public class SubscriptionResponse {

    @JsonProperty("subscriber")
    String subscriber;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("expiry")
    Instant expiry;

    @JsonProperty("subscribed")
    boolean subscribed;

    public static SubscriptionResponse from(Subscription subscription, boolean subscribed) {
        return SubscriptionResponse.builder()
            .subscriber(subscription.getSubscriber().getValue())
            .creator(subscription.getCreator().getValue())
            .active(subscription.isActive())
            .expiry(subscription.getExpiry())
            .subscribed(subscribed)
            .build();
    }
}
