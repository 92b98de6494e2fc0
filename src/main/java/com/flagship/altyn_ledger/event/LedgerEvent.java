package com.flagship.altyn_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a committed ledger change, published through the outbox.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getAggregateId();

    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
