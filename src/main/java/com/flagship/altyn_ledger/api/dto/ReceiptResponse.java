package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.settlement.Receipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReceiptResponse {

    @JsonProperty("receipt_id")
    UUID receiptId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("type")
    String type;

    @JsonProperty("listing_id")
    String listingId;

    @JsonProperty("buyer_name")
    String buyerName;

    @JsonProperty("seller_name")
    String sellerName;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("status")
    String status;

    public static ReceiptResponse from(Receipt receipt) {
        return ReceiptResponse.builder()
            .receiptId(receipt.getReceiptId())
            .transactionId(receipt.getTransactionId())
            .date(receipt.getDate())
            .type(receipt.getType().name())
            .listingId(receipt.getListingId())
            .buyerName(receipt.getBuyerName())
            .sellerName(receipt.getSellerName())
            .totalPaid(receipt.getTotalPaid())
            .feeAmount(receipt.getFeeAmount())
            .status(receipt.getStatus().name())
            .build();
    }
}
