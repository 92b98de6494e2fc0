package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.wallet.WalletView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("user_name")
    String userName;

    @JsonProperty("coin_balance")
    BigDecimal coinBalance;

    @JsonProperty("token_balance")
    BigDecimal tokenBalance;

    @JsonProperty("token_percentage")
    BigDecimal tokenPercentage;

    @JsonProperty("pending_dividends")
    BigDecimal pendingDividends;

    public static WalletResponse from(WalletView view) {
        return WalletResponse.builder()
            .userId(view.getUserId())
            .userName(view.getUserName())
            .coinBalance(view.getCoinBalance())
            .tokenBalance(view.getTokenBalance())
            .tokenPercentage(view.getTokenPercentage())
            .pendingDividends(view.getPendingDividends())
            .build();
    }
}
