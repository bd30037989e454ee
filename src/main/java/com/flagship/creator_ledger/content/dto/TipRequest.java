package com.flagship.creator_ledger.content.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

@Value
public class TipRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
