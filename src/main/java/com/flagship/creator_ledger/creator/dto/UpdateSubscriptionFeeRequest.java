package com.flagship.creator_ledger.creator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Zero switches subscriptions off.
 */
@Value
public class UpdateSubscriptionFeeRequest {

    @NotNull(message = "Subscription fee is required")
    @PositiveOrZero(message = "Subscription fee must not be negative")
    @JsonProperty("subscription_fee")
    BigInteger subscriptionFee;
}
