package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.treasury.TreasuryStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TreasuryResponse {

    @JsonProperty("collected_fees")
    BigDecimal collectedFees;

    @JsonProperty("total_coins_in_circulation")
    BigDecimal totalCoinsInCirculation;

    @JsonProperty("total_token_supply")
    BigDecimal totalTokenSupply;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("recent_emissions")
    List<TransactionResponse> recentEmissions;

    @JsonProperty("recent_dividends")
    List<DividendPayoutResponse> recentDividends;

    public static TreasuryResponse from(TreasuryStats stats) {
        return TreasuryResponse.builder()
            .collectedFees(stats.getTreasury().getCollectedFees())
            .totalCoinsInCirculation(stats.getTreasury().getTotalCoinsInCirculation())
            .totalTokenSupply(stats.getTreasury().getTotalTokenSupply())
            .updatedAt(stats.getTreasury().getUpdatedAt())
            .recentEmissions(stats.getRecentEmissions().stream().map(TransactionResponse::from).toList())
            .recentDividends(stats.getRecentDividends().stream().map(DividendPayoutResponse::from).toList())
            .build();
    }
}
