package com.flagship.creator_ledger.payment;

import lombok.Value;

/**
 * Outcome of a single {@link PaymentGateway#transfer} call.
 */
@Value
public class TransferResult {
    boolean success;
    String reference;
    String failureReason;

    public static TransferResult succeeded(String reference) {
        return new TransferResult(true, reference, null);
    }

    public static TransferResult failed(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new TransferResult(false, null, reason);
    }
}
