package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.treasury.EmissionService.WalletInitialization;
import lombok.Value;

@Value
public class WalletInitializationResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("user_email")
    String userEmail;

    @JsonProperty("token_transaction")
    TransactionResponse tokenTransaction;

    @JsonProperty("coin_transaction")
    TransactionResponse coinTransaction;

    public static WalletInitializationResponse from(WalletInitialization init) {
        return new WalletInitializationResponse(
            init.getUserId(),
            init.getEmail(),
            TransactionResponse.from(init.getTokenTransaction()),
            TransactionResponse.from(init.getCoinTransaction()));
    }
}
