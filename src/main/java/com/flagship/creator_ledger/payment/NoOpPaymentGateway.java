package com.flagship.creator_ledger.payment;

import com.flagship.creator_ledger.ledger.Address;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Gateway used when no token integration is configured: logs the transfer it
 * would have made and reports success. Counters then move without value movement,
 * the same as a deployment that never wires a real token.
 */
@Slf4j
public class NoOpPaymentGateway implements PaymentGateway {

    private final String paymentToken;

    public NoOpPaymentGateway(String paymentToken) {
        this.paymentToken = paymentToken;
    }

    @Override
    public TransferResult transfer(Address from, Address to, BigInteger amount) {
        log.info("Transfer not executed (no payment integration): token={}, from={}, to={}, amount={}",
                paymentToken, from, to, amount);
        return TransferResult.succeeded("noop");
    }
}
