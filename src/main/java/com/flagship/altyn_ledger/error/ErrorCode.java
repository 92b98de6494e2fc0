package com.flagship.altyn_ledger.error;

/**
 * Stable error codes surfaced to callers of the ledger.
 * The names are part of the API contract and must not be renamed.
 */
public enum ErrorCode {
    INVALID_AMOUNT,
    INSUFFICIENT_FUNDS,
    SELF_TRANSFER_NOT_ALLOWED,
    UNAUTHORIZED,
    NOTHING_TO_DISTRIBUTE,
    NOT_FOUND
}
