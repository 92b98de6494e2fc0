package com.flagship.altyn_ledger.error;

/**
 * A referenced user, receipt or currency does not resolve.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
