package com.flagship.creator_ledger.creator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.creator_ledger.creator.CreatorProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CreatorProfileResponse {

    @JsonProperty("creator")
    String creator;

    @JsonProperty("profile_data")
    String profileData;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static CreatorProfileResponse from(CreatorProfile profile) {
        return CreatorProfileResponse.builder()
            .creator(profile.getCreator().getValue())
            .profileData(profile.getProfileData())
            .registeredAt(profile.getRegisteredAt())
            .build();
    }
}
