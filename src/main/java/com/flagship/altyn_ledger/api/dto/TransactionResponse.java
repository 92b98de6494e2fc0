package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    String type;

    @JsonProperty("asset_type")
    String assetType;

    @JsonProperty("from_user_id")
    String fromUserId;

    @JsonProperty("to_user_id")
    String toUserId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction tx) {
        if (tx == null) {
            return null;
        }
        return TransactionResponse.builder()
            .id(tx.getId())
            .type(tx.getType().name())
            .assetType(tx.getAssetType().name())
            .fromUserId(tx.getFromUserId())
            .toUserId(tx.getToUserId())
            .amount(tx.getAmount())
            .fee(tx.getFee())
            .netAmount(tx.getNetAmount())
            .description(tx.getDescription())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}
