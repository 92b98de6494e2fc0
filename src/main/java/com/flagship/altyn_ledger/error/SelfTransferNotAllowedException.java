package com.flagship.altyn_ledger.error;

public class SelfTransferNotAllowedException extends LedgerException {

    public SelfTransferNotAllowedException(String userId) {
        super(ErrorCode.SELF_TRANSFER_NOT_ALLOWED,
                "Sender and recipient must be different: " + userId);
    }
}
