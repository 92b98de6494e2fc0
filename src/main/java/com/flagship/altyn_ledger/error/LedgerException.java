package com.flagship.altyn_ledger.error;

/**
 * Base type for every business rejection raised by the ledger engine.
 *
 * All subclasses are raised before any balance is mutated, or from inside the
 * transactional unit so the whole unit rolls back.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
