package com.flagship.altyn_ledger.error;

public class NothingToDistributeException extends LedgerException {

    public NothingToDistributeException(String message) {
        super(ErrorCode.NOTHING_TO_DISTRIBUTE, message);
    }
}
