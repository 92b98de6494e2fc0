package com.flagship.altyn_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted once per dividend run, after every holder has been credited.
 */
@Value
public class DividendsDistributedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "DividendsDistributed";
    public static final String AGGREGATE_TYPE = "DividendPayout";

    UUID eventId;
    UUID payoutId;
    BigDecimal totalDistributed;
    int holdersCount;
    BigDecimal tokenSupply;
    String distributedBy;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return payoutId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
