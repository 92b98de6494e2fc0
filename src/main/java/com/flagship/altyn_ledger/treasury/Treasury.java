package com.flagship.altyn_ledger.treasury;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of the singleton treasury account.
 */
@Value
public class Treasury {
    BigDecimal collectedFees;
    BigDecimal totalCoinsInCirculation;
    BigDecimal totalTokenSupply;
    Instant updatedAt;

    public boolean hasFeesToDistribute() {
        return collectedFees.signum() > 0;
    }
}
