package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.treasury.ReconciliationReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("balanced")
    boolean balanced;

    @JsonProperty("coin_wallet_total")
    BigDecimal coinWalletTotal;

    @JsonProperty("collected_fees")
    BigDecimal collectedFees;

    @JsonProperty("total_coins_in_circulation")
    BigDecimal totalCoinsInCirculation;

    @JsonProperty("coins_emitted")
    BigDecimal coinsEmitted;

    @JsonProperty("fees_charged")
    BigDecimal feesCharged;

    @JsonProperty("dividends_paid")
    BigDecimal dividendsPaid;

    @JsonProperty("coin_discrepancy")
    BigDecimal coinDiscrepancy;

    @JsonProperty("token_wallet_total")
    BigDecimal tokenWalletTotal;

    @JsonProperty("total_token_supply")
    BigDecimal totalTokenSupply;

    @JsonProperty("tokens_issued")
    BigDecimal tokensIssued;

    @JsonProperty("token_discrepancy")
    BigDecimal tokenDiscrepancy;

    @JsonProperty("checked_at")
    Instant checkedAt;

    public static ReconciliationResponse from(ReconciliationReport report) {
        return ReconciliationResponse.builder()
            .balanced(report.isBalanced())
            .coinWalletTotal(report.getCoinWalletTotal())
            .collectedFees(report.getCollectedFees())
            .totalCoinsInCirculation(report.getTotalCoinsInCirculation())
            .coinsEmitted(report.getCoinsEmitted())
            .feesCharged(report.getFeesCharged())
            .dividendsPaid(report.getDividendsPaid())
            .coinDiscrepancy(report.getCoinDiscrepancy())
            .tokenWalletTotal(report.getTokenWalletTotal())
            .totalTokenSupply(report.getTotalTokenSupply())
            .tokensIssued(report.getTokensIssued())
            .tokenDiscrepancy(report.getTokenDiscrepancy())
            .checkedAt(report.getCheckedAt())
            .build();
    }
}
