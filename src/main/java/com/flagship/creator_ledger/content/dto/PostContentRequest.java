package com.flagship.creator_ledger.content.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for publishing a content record.
 * The hash is opaque; an empty string is accepted.
 */
@Value
public class PostContentRequest {

    @NotNull(message = "Content hash is required")
    @JsonProperty("content_hash")
    String contentHash;

    @JsonProperty("is_premium")
    boolean premium;

    @JsonProperty("tip_enabled")
    boolean tipEnabled;
}
