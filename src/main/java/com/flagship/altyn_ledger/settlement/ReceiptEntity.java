package com.flagship.altyn_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the receipts table. No setters: a receipt is written once.
 */
@Entity
@Table(name = "receipts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReceiptEntity {

    @Id
    @Column(name = "receipt_id", nullable = false, updatable = false)
    private UUID receiptId;

    @Column(name = "transaction_id", nullable = false, updatable = false, unique = true)
    private UUID transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 32)
    private PaymentType paymentType;

    @Column(name = "listing_id", nullable = false, updatable = false, length = 64)
    private String listingId;

    @Column(name = "buyer_id", nullable = false, updatable = false, length = 64)
    private String buyerId;

    @Column(name = "buyer_name", nullable = false, updatable = false)
    private String buyerName;

    @Column(name = "seller_id", nullable = false, updatable = false, length = 64)
    private String sellerId;

    @Column(name = "seller_name", nullable = false, updatable = false)
    private String sellerName;

    @Column(name = "total_paid", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalPaid;

    @Column(name = "fee_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal feeAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 16)
    private ReceiptStatus status;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    static ReceiptEntity fromDomain(Receipt receipt) {
        return new ReceiptEntity(
            receipt.getReceiptId(),
            receipt.getTransactionId(),
            receipt.getType(),
            receipt.getListingId(),
            receipt.getBuyerId(),
            receipt.getBuyerName(),
            receipt.getSellerId(),
            receipt.getSellerName(),
            receipt.getTotalPaid(),
            receipt.getFeeAmount(),
            receipt.getStatus(),
            receipt.getDate()
        );
    }

    public Receipt toDomain() {
        return new Receipt(
            receiptId,
            transactionId,
            issuedAt,
            paymentType,
            listingId,
            buyerId,
            buyerName,
            sellerId,
            sellerName,
            totalPaid,
            feeAmount,
            status
        );
    }
}
