package com.flagship.altyn_ledger.settlement;

import com.flagship.altyn_ledger.transaction.TransactionType;

/**
 * What a buyer is paying for. Each maps to a fee-bearing transaction type.
 */
public enum PaymentType {
    MARKETPLACE_PURCHASE(TransactionType.MARKETPLACE_PURCHASE, "Marketplace purchase"),
    SERVICE_PAYMENT(TransactionType.SERVICE_PAYMENT, "Service payment");

    private final TransactionType transactionType;
    private final String label;

    PaymentType(TransactionType transactionType, String label) {
        this.transactionType = transactionType;
        this.label = label;
    }

    public TransactionType toTransactionType() {
        return transactionType;
    }

    public String describe(String listingId) {
        return label + ": " + listingId;
    }
}
