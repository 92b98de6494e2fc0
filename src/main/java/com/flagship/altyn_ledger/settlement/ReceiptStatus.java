package com.flagship.altyn_ledger.settlement;

public enum ReceiptStatus {
    COMPLETED,
    FAILED
}
