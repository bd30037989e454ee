package com.flagship.creator_ledger.creator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class RegisterCreatorRequest {

    @NotBlank(message = "Profile data is required")
    @JsonProperty("profile_data")
    String profileData;
}
