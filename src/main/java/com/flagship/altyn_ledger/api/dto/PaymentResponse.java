package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.settlement.SettlementResult;
import lombok.Value;

@Value
public class PaymentResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("receipt")
    ReceiptResponse receipt;

    public static PaymentResponse from(SettlementResult result) {
        return new PaymentResponse(
            TransactionResponse.from(result.getTransaction()),
            ReceiptResponse.from(result.getReceipt()));
    }
}
