package com.flagship.creator_ledger.content.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.creator_ledger.content.Content;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response DTO for content records.
 */
@Value
@Builder
public class ContentResponse {

    @JsonProperty("content_id")
    long contentId;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("content_hash")
    String contentHash;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("is_premium")
    boolean premium;

    @JsonProperty("tip_enabled")
    boolean tipEnabled;

    @JsonProperty("total_tips")
    BigInteger totalTips;

    @JsonProperty("total_engagements")
    long totalEngagements;

    public static ContentResponse from(Content content) {
        return ContentResponse.builder()
            .contentId(content.getId().getValue())
            .creator(content.getCreator().getValue())
            .contentHash(content.getContentHash())
            .timestamp(content.getTimestamp())
            .premium(content.isPremium())
            .tipEnabled(content.isTipEnabled())
            .totalTips(content.getTotalTips())
            .totalEngagements(content.getTotalEngagements())
            .build();
    }
}
