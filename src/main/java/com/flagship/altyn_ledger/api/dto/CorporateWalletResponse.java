package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.corporate.CorporateWalletView;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Value
public class CorporateWalletResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("organization_id")
    String organizationId;

    @JsonProperty("organization_name")
    String organizationName;

    @JsonProperty("coin_balance")
    BigDecimal coinBalance;

    @JsonProperty("coin_values")
    Map<String, BigDecimal> coinValues;

    @JsonProperty("is_admin")
    boolean admin;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CorporateWalletResponse from(CorporateWalletView view) {
        return new CorporateWalletResponse(
            view.getAccountId(),
            view.getOrganizationId(),
            view.getOrganizationName(),
            view.getCoinBalance(),
            view.getCoinValues(),
            view.isCallerIsAdmin(),
            view.getCreatedBy(),
            view.getCreatedAt());
    }
}
