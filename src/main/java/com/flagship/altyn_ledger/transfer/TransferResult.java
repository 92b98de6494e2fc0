package com.flagship.altyn_ledger.transfer;

import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

/**
 * Outcome of a transfer. {@code replayed} is true when the idempotency key had
 * already been settled and no funds moved this time.
 */
@Value
public class TransferResult {
    LedgerTransaction transaction;
    boolean replayed;

    static TransferResult settled(LedgerTransaction transaction) {
        return new TransferResult(transaction, false);
    }

    static TransferResult replayOf(LedgerTransaction transaction) {
        return new TransferResult(transaction, true);
    }
}
