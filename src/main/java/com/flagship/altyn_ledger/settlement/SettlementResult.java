package com.flagship.altyn_ledger.settlement;

import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

@Value
public class SettlementResult {
    LedgerTransaction transaction;
    Receipt receipt;
    boolean replayed;
}
