package com.flagship.altyn_ledger.transaction;

/**
 * Kind of balance-affecting event recorded in the transaction log.
 */
public enum TransactionType {
    TRANSFER(true),
    EMISSION(false),
    DIVIDEND(false),
    MARKETPLACE_PURCHASE(true),
    SERVICE_PAYMENT(true);

    private final boolean feeBearing;

    TransactionType(boolean feeBearing) {
        this.feeBearing = feeBearing;
    }

    /**
     * Fee-bearing types move value between two wallets and withhold the
     * treasury fee from the recipient. The others originate from the treasury.
     */
    public boolean isFeeBearing() {
        return feeBearing;
    }
}
