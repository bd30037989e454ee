package com.flagship.creator_ledger.ledger;

import com.flagship.creator_ledger.payment.PlatformFee;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration fixed when the ledger is created and read-only afterwards.
 */
@Value
public class LedgerSettings {

    public static final Duration DEFAULT_SUBSCRIPTION_PERIOD = Duration.ofDays(30);

    String paymentToken;
    PlatformFee platformFee;
    Address treasury;
    Duration subscriptionPeriod;

    public LedgerSettings(String paymentToken, PlatformFee platformFee, Address treasury, Duration subscriptionPeriod) {
        if (paymentToken == null || paymentToken.isBlank()) {
            throw new IllegalArgumentException("Payment token is required");
        }
        if (subscriptionPeriod == null || subscriptionPeriod.isZero() || subscriptionPeriod.isNegative()) {
            throw new IllegalArgumentException("Subscription period must be positive");
        }
        this.paymentToken = paymentToken;
        this.platformFee = Objects.requireNonNull(platformFee, "platformFee");
        this.treasury = Objects.requireNonNull(treasury, "treasury");
        this.subscriptionPeriod = subscriptionPeriod;
    }
}
