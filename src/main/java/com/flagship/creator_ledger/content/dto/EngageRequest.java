package com.flagship.creator_ledger.content.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class EngageRequest {

    @NotBlank(message = "Engagement type is required")
    @JsonProperty("engagement_type")
    String engagementType;
}
