package com.flagship.creator_ledger.payment;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.LedgerSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Collects subscription fees and tips through the {@link PaymentGateway}.
 *
 * The creator share goes payer → creator, the platform share payer → treasury.
 * Any refused transfer fails the whole ledger call with {@link ErrorCode#PAYMENT_FAILED},
 * so callers must collect before they write counters. If the treasury leg is refused
 * after the creator leg went through, the creator leg is transferred back first.
 */
@Service
@Slf4j
public class PaymentService {

    private final PaymentGateway paymentGateway;
    private final LedgerSettings settings;

    public PaymentService(PaymentGateway paymentGateway, LedgerSettings settings) {
        this.paymentGateway = paymentGateway;
        this.settings = settings;
    }

    /**
     * @param payer caller paying the amount
     * @param creator creator receiving the amount minus the platform fee
     * @param amount gross amount, must be positive
     * @param purpose short label for logs ("subscription", "tip")
     * @return how the amount was split
     * @throws LedgerException PAYMENT_FAILED if the gateway refuses a transfer
     */
    public PlatformFee.FeeSplit collect(Address payer, Address creator, BigInteger amount, String purpose) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }

        PlatformFee.FeeSplit split = settings.getPlatformFee().split(amount);
        BigInteger creatorShare = split.getCreatorShare();
        BigInteger platformShare = split.getPlatformShare();

        if (creatorShare.signum() > 0) {
            requireSuccess(paymentGateway.transfer(payer, creator, creatorShare), purpose, creator);
        }
        if (platformShare.signum() > 0) {
            TransferResult treasuryLeg = paymentGateway.transfer(payer, settings.getTreasury(), platformShare);
            if (treasuryLeg == null || !treasuryLeg.isSuccess()) {
                if (creatorShare.signum() > 0) {
                    refund(creator, payer, creatorShare, purpose);
                }
                requireSuccess(treasuryLeg, purpose, settings.getTreasury());
            }
        }

        log.debug("Collected {} {}: payer={}, creator={}, creatorShare={}, platformShare={}",
                purpose, amount, payer, creator, creatorShare, platformShare);
        return split;
    }

    /**
     * Reverses a creator leg that already went through.
     *
     * @throws LedgerException PAYMENT_FAILED naming the stranded amount if the reversal is refused
     */
    private void refund(Address creator, Address payer, BigInteger amount, String purpose) {
        TransferResult reversal = paymentGateway.transfer(creator, payer, amount);
        if (reversal == null || !reversal.isSuccess()) {
            String reason = reversal != null ? reversal.getFailureReason() : "no result from payment gateway";
            log.error("Refund failed, {} stranded with creator: purpose={}, creator={}, payer={}, reason={}",
                    amount, purpose, creator, payer, reason);
            throw new LedgerException(ErrorCode.PAYMENT_FAILED,
                String.format("%s payment to treasury failed and the refund of %s from %s to %s failed: %s",
                    purpose, amount, creator, payer, reason));
        }
        log.warn("Refunded {} from {} to {} after the treasury leg of a {} payment failed",
                amount, creator, payer, purpose);
    }

    private void requireSuccess(TransferResult result, String purpose, Address payee) {
        if (result == null || !result.isSuccess()) {
            String reason = result != null ? result.getFailureReason() : "no result from payment gateway";
            throw new LedgerException(ErrorCode.PAYMENT_FAILED,
                String.format("%s payment to %s failed: %s", purpose, payee, reason));
        }
    }
}
