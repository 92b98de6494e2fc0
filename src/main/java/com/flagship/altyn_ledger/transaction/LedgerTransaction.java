package com.flagship.altyn_ledger.transaction;

import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable transaction log entry.
 *
 * Invariants:
 * - netAmount = amount - fee
 * - fee = 0 for EMISSION and DIVIDEND, which have no sender
 * - never updated or deleted once appended; corrections are new entries
 */
@Value
public class LedgerTransaction {
    UUID id;
    TransactionType type;
    AssetType assetType;
    String fromUserId;
    String toUserId;
    BigDecimal amount;
    BigDecimal fee;
    BigDecimal netAmount;
    String description;
    String idempotencyKey;
    Instant createdAt;
    Long sequenceNumber;

    /**
     * Creates an entry for a movement between two wallets (transfer or payment).
     */
    public static LedgerTransaction movement(TransactionType type, AssetType assetType,
                                             String fromUserId, String toUserId,
                                             BigDecimal amount, BigDecimal fee,
                                             String description, String idempotencyKey) {
        if (!type.isFeeBearing()) {
            throw new IllegalArgumentException(type + " is not a wallet-to-wallet movement");
        }
        if (fromUserId == null) {
            throw new IllegalArgumentException("Sender is required for " + type);
        }
        return new LedgerTransaction(
            UUID.randomUUID(),
            type,
            assetType,
            fromUserId,
            toUserId,
            amount,
            fee,
            amount.subtract(fee),
            description,
            idempotencyKey,
            Instant.now(),
            null  // sequence assigned by database
        );
    }

    /**
     * Creates an entry for newly minted COIN or newly issued TOKEN.
     */
    public static LedgerTransaction emission(AssetType assetType, String toUserId,
                                             BigDecimal amount, String description) {
        return fromTreasury(TransactionType.EMISSION, assetType, toUserId, amount, description);
    }

    /**
     * Creates an entry for a dividend credit paid out of the treasury fee pool.
     */
    public static LedgerTransaction dividend(String toUserId, BigDecimal amount, String description) {
        return fromTreasury(TransactionType.DIVIDEND, AssetType.COIN, toUserId, amount, description);
    }

    private static LedgerTransaction fromTreasury(TransactionType type, AssetType assetType,
                                                  String toUserId, BigDecimal amount, String description) {
        return new LedgerTransaction(
            UUID.randomUUID(),
            type,
            assetType,
            null,
            toUserId,
            amount,
            LedgerAmounts.zero(AssetType.COIN),
            amount,
            description,
            null,
            Instant.now(),
            null
        );
    }

    /**
     * Returns a copy carrying the sequence number assigned on append.
     */
    LedgerTransaction withSequenceNumber(long sequence) {
        return new LedgerTransaction(id, type, assetType, fromUserId, toUserId, amount, fee,
            netAmount, description, idempotencyKey, createdAt, sequence);
    }

    /**
     * True when this entry records the given movement. Amounts compare by value.
     */
    public boolean isSameMovement(TransactionType type, AssetType assetType, String fromUserId,
                                  String toUserId, BigDecimal amount) {
        return this.type == type
            && this.assetType == assetType
            && Objects.equals(this.fromUserId, fromUserId)
            && Objects.equals(this.toUserId, toUserId)
            && amount != null
            && this.amount.compareTo(amount) == 0;
    }
}
