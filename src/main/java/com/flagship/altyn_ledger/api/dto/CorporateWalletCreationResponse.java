package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.corporate.CorporateWalletCreation;
import lombok.Value;

@Value
public class CorporateWalletCreationResponse {

    @JsonProperty("created")
    boolean created;

    @JsonProperty("message")
    String message;

    @JsonProperty("wallet")
    CorporateWalletResponse wallet;

    public static CorporateWalletCreationResponse from(CorporateWalletCreation creation) {
        return new CorporateWalletCreationResponse(
            creation.isCreated(),
            creation.isCreated() ? "Corporate wallet created" : "Corporate wallet already exists",
            CorporateWalletResponse.from(creation.getWallet()));
    }
}
