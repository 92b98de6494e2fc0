package com.flagship.altyn_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Buyer-facing record of a completed payment. Immutable once issued.
 */
@Value
public class Receipt {
    UUID receiptId;
    UUID transactionId;
    Instant date;
    PaymentType type;
    String listingId;
    String buyerId;
    String buyerName;
    String sellerId;
    String sellerName;
    BigDecimal totalPaid;
    BigDecimal feeAmount;
    ReceiptStatus status;

    public boolean isVisibleTo(String userId) {
        return userId != null && (userId.equals(buyerId) || userId.equals(sellerId));
    }
}
