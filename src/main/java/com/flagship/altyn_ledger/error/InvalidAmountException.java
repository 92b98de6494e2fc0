package com.flagship.altyn_ledger.error;

/**
 * Amount is missing, not positive, or carries more fraction digits than the asset supports.
 */
public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }
}
