package com.flagship.creator_ledger.ledger;

/**
 * Caller-visible rejection reasons.
 *
 * Every code aborts the whole call: no state change and no notification.
 */
public enum ErrorCode {
    ALREADY_REGISTERED,
    NOT_A_CREATOR,
    SUBSCRIPTIONS_NOT_ENABLED,
    TIPPING_NOT_ENABLED,
    INVALID_AMOUNT,
    ALREADY_ENGAGED,
    NOT_SUBSCRIBED,
    NOT_FOUND,

    /**
     * Platform fee above 1000 basis points. Raised at initialization only.
     */
    FEE_TOO_HIGH,

    /**
     * The payment collaborator refused one of the transfers of a subscribe or tip call.
     */
    PAYMENT_FAILED,

    INVALID_PROFILE_DATA
}
