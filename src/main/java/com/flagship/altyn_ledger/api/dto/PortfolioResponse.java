package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.wallet.PortfolioView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class PortfolioResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("user_name")
    String userName;

    @JsonProperty("coin")
    CoinHolding coin;

    @JsonProperty("token")
    TokenHolding token;

    @JsonProperty("dividends")
    Dividends dividends;

    @Value
    public static class CoinHolding {
        @JsonProperty("balance")
        BigDecimal balance;

        // Currency code -> value of the balance in that currency.
        @JsonProperty("values")
        Map<String, BigDecimal> values;
    }

    @Value
    public static class TokenHolding {
        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("percentage")
        BigDecimal percentage;
    }

    @Value
    public static class Dividends {
        @JsonProperty("total_received")
        BigDecimal totalReceived;

        @JsonProperty("pending")
        BigDecimal pending;
    }

    public static PortfolioResponse from(PortfolioView view) {
        return PortfolioResponse.builder()
            .userId(view.getUserId())
            .userName(view.getUserName())
            .coin(new CoinHolding(view.getCoinBalance(), view.getCoinValues()))
            .token(new TokenHolding(view.getTokenBalance(), view.getTokenPercentage()))
            .dividends(new Dividends(view.getDividendsReceived(), view.getPendingDividends()))
            .build();
    }
}
