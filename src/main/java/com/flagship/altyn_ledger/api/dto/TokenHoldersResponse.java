package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.wallet.TokenHolderList;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class TokenHoldersResponse {

    @JsonProperty("holders")
    List<HolderEntry> holders;

    @JsonProperty("total_supply")
    BigDecimal totalSupply;

    @JsonProperty("holders_count")
    long holdersCount;

    @Value
    public static class HolderEntry {
        @JsonProperty("rank")
        int rank;

        @JsonProperty("user_id")
        String userId;

        @JsonProperty("user_name")
        String userName;

        @JsonProperty("token_balance")
        BigDecimal tokenBalance;

        @JsonProperty("percentage")
        BigDecimal percentage;
    }

    public static TokenHoldersResponse from(TokenHolderList list) {
        List<HolderEntry> entries = list.getHolders().stream()
            .map(h -> new HolderEntry(h.getRank(), h.getUserId(), h.getUserName(), h.getTokenBalance(), h.getPercentage()))
            .toList();
        return new TokenHoldersResponse(entries, list.getTotalSupply(), list.getHoldersCount());
    }
}
