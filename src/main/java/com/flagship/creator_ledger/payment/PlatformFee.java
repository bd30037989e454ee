package com.flagship.creator_ledger.payment;

import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerException;
import lombok.Value;

import java.math.BigInteger;

/**
 * Platform cut taken from subscription fees and tips, in basis points.
 * Fixed at ledger initialization; at most 1000 (10%).
 */
@Value
public class PlatformFee {

    public static final int MAX_BASIS_POINTS = 1000;
    private static final BigInteger BASIS_POINT_DIVISOR = BigInteger.valueOf(10_000);

    int basisPoints;

    private PlatformFee(int basisPoints) {
        this.basisPoints = basisPoints;
    }

    /**
     * @throws LedgerException {@link ErrorCode#FEE_TOO_HIGH} above 1000 basis points
     */
    public static PlatformFee ofBasisPoints(int basisPoints) {
        if (basisPoints < 0) {
            throw new IllegalArgumentException("Platform fee must not be negative: " + basisPoints);
        }
        if (basisPoints > MAX_BASIS_POINTS) {
            throw new LedgerException(ErrorCode.FEE_TOO_HIGH,
                String.format("Platform fee of %d basis points exceeds the maximum of %d",
                    basisPoints, MAX_BASIS_POINTS));
        }
        return new PlatformFee(basisPoints);
    }

    /**
     * Splits a gross amount; the platform share is rounded down.
     */
    public FeeSplit split(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative");
        }
        BigInteger platformShare = amount.multiply(BigInteger.valueOf(basisPoints)).divide(BASIS_POINT_DIVISOR);
        return new FeeSplit(amount.subtract(platformShare), platformShare);
    }

    @Value
    public static class FeeSplit {
        BigInteger creatorShare;
        BigInteger platformShare;
    }
}
