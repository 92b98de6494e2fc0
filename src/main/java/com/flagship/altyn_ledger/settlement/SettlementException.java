package com.flagship.altyn_ledger.settlement;

import com.flagship.altyn_ledger.error.LedgerException;

/**
 * A payment for a listing was rejected. Carries the underlying ledger error
 * code and message unchanged, plus which listing the payment was for.
 * No receipt exists for a payment that ended in this exception.
 */
public class SettlementException extends LedgerException {

    private final String listingId;
    private final PaymentType paymentType;

    public SettlementException(LedgerException cause, String listingId, PaymentType paymentType) {
        super(cause.getErrorCode(), cause.getMessage());
        initCause(cause);
        this.listingId = listingId;
        this.paymentType = paymentType;
    }

    public String getListingId() {
        return listingId;
    }

    public PaymentType getPaymentType() {
        return paymentType;
    }
}
