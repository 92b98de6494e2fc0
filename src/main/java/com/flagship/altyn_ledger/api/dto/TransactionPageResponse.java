package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.wallet.TransactionPage;
import lombok.Value;

import java.util.List;

@Value
public class TransactionPageResponse {

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("total")
    long total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;

    public static TransactionPageResponse from(TransactionPage page) {
        return new TransactionPageResponse(
            page.getTransactions().stream().map(TransactionResponse::from).toList(),
            page.getTotal(),
            page.getLimit(),
            page.getOffset());
    }
}
