package com.flagship.altyn_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox to be shipped to Kafka.
 *
 * Written in the same database transaction as the ledger change it
 * describes, so an event exists if and only if that change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // LedgerTransaction or DividendPayout
    UUID aggregateId;
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until shipped
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId,
                                      String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
