package com.flagship.altyn_ledger.transfer;

import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One requested movement between two wallets.
 *
 * {@code idempotencyKey} is optional. When set, it must already be scoped to
 * the sender so two users can never collide on the same key.
 */
@Value
@Builder
public class TransferCommand {
    @Builder.Default
    TransactionType type = TransactionType.TRANSFER;
    String fromUserId;
    String toUserId;
    @Builder.Default
    AssetType assetType = AssetType.COIN;
    BigDecimal amount;
    String description;
    String idempotencyKey;
}
