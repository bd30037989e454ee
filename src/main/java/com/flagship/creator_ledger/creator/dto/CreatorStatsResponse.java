package com.flagship.creator_ledger.creator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.creator_ledger.creator.CreatorStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class CreatorStatsResponse {

    @JsonProperty("creator")
    String creator;

    @JsonProperty("total_subscribers")
    long totalSubscribers;

    @JsonProperty("total_content")
    long totalContent;

    @JsonProperty("total_tips_received")
    BigInteger totalTipsReceived;

    @JsonProperty("subscription_fee")
    BigInteger subscriptionFee;

    @JsonProperty("engagement_score")
    long engagementScore;

    public static CreatorStatsResponse from(CreatorStats stats) {
        return CreatorStatsResponse.builder()
            .creator(stats.getCreator().getValue())
            .totalSubscribers(stats.getTotalSubscribers())
            .totalContent(stats.getTotalContent())
            .totalTipsReceived(stats.getTotalTipsReceived())
            .subscriptionFee(stats.getSubscriptionFee())
            .engagementScore(stats.getEngagementScore())
            .build();
    }
}
