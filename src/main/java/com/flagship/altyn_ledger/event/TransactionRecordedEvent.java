package com.flagship.altyn_ledger.event;

import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted for every transaction appended to the log: transfers, payments,
 * emissions and dividend credits.
 */
@Value
public class TransactionRecordedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "TransactionRecorded";
    public static final String AGGREGATE_TYPE = "LedgerTransaction";

    UUID eventId;
    UUID transactionId;
    String transactionType;
    String assetType;
    String fromUserId;
    String toUserId;
    BigDecimal amount;
    BigDecimal fee;
    BigDecimal netAmount;
    Long sequenceNumber;
    Instant occurredAt;

    public static TransactionRecordedEvent of(LedgerTransaction tx) {
        return new TransactionRecordedEvent(
            UUID.randomUUID(),
            tx.getId(),
            tx.getType().name(),
            tx.getAssetType().name(),
            tx.getFromUserId(),
            tx.getToUserId(),
            tx.getAmount(),
            tx.getFee(),
            tx.getNetAmount(),
            tx.getSequenceNumber(),
            tx.getCreatedAt()
        );
    }

    @Override
    public UUID getAggregateId() {
        return transactionId;
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
