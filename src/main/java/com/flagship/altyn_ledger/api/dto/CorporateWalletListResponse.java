package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.corporate.CorporateWalletSummary;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class CorporateWalletListResponse {

    @JsonProperty("corporate_wallets")
    List<Entry> corporateWallets;

    public static CorporateWalletListResponse from(List<CorporateWalletSummary> summaries) {
        return new CorporateWalletListResponse(summaries.stream().map(Entry::from).toList());
    }

    @Value
    public static class Entry {

        @JsonProperty("organization_id")
        String organizationId;

        @JsonProperty("organization_name")
        String organizationName;

        @JsonProperty("has_wallet")
        boolean hasWallet;

        // null when the organization has no wallet yet
        @JsonProperty("coin_balance")
        BigDecimal coinBalance;

        static Entry from(CorporateWalletSummary summary) {
            return new Entry(
                summary.getOrganizationId(),
                summary.getOrganizationName(),
                summary.isHasWallet(),
                summary.getCoinBalance());
        }
    }
}
