package com.flagship.creator_ledger.ledger;

import lombok.Getter;

/**
 * Synchronous rejection of a ledger call.
 * Thrown before any write, so the runtime can discard the whole unit of work.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
