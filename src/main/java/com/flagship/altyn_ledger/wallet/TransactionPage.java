package com.flagship.altyn_ledger.wallet;

import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

import java.util.List;

@Value
public class TransactionPage {
    List<LedgerTransaction> transactions;
    long total;
    int limit;
    int offset;
}
