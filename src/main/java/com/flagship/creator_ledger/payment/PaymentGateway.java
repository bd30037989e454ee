package com.flagship.creator_ledger.payment;

import com.flagship.creator_ledger.ledger.Address;

import java.math.BigInteger;

/**
 * External value-transfer capability (the payment token).
 *
 * The ledger only calls it; moving the funds is the collaborator's business.
 * Transfers are not rolled back with a failed ledger call; a transfer that
 * already went through is reversed with an explicit transfer back.
 */
public interface PaymentGateway {

    /**
     * Moves {@code amount} of the configured payment token from {@code from} to {@code to}.
     *
     * @return success or failure with a reason; never {@code null}
     */
    TransferResult transfer(Address from, Address to, BigInteger amount);
}
