package com.flagship.altyn_ledger.corporate;

import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

/**
 * A log entry seen from the corporate wallet's side.
 */
@Value
public class CorporateTransaction {

    public enum Direction {
        INCOMING,
        OUTGOING
    }

    public enum CounterpartyType {
        USER,
        ORGANIZATION,
        TREASURY
    }

    LedgerTransaction transaction;
    Direction direction;
    String counterpartyId;
    String counterpartyName;
    CounterpartyType counterpartyType;
}
