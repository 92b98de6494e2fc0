package com.flagship.altyn_ledger.corporate;

import lombok.Value;

import java.util.List;

@Value
public class CorporateTransactionPage {
    String organizationId;
    List<CorporateTransaction> transactions;
    long total;
    int limit;
    int offset;
}
