package com.flagship.altyn_ledger.error;

/**
 * Caller lacks the capability required for the operation (admin-only flows,
 * foreign receipts, TOKEN moves by regular users).
 */
public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
