package com.flagship.altyn_ledger.dividend;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Record of one dividend run.
 *
 * Invariant: the sum of {@code distributionDetails[].amount} equals
 * {@code totalDistributed} exactly, and equals the fee pool before the run.
 */
@Value
public class DividendPayout {
    UUID id;
    BigDecimal totalDistributed;
    int holdersCount;
    BigDecimal tokenSupply;
    String distributedBy;
    Instant createdAt;
    List<DividendShare> distributionDetails;
}
