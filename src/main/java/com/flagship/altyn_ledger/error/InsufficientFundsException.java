package com.flagship.altyn_ledger.error;

import com.flagship.altyn_ledger.ledger.AssetType;

import java.math.BigDecimal;

/**
 * A debit would drive a wallet balance below zero.
 */
public class InsufficientFundsException extends LedgerException {

    private final String userId;
    private final AssetType assetType;
    private final BigDecimal requested;

    public InsufficientFundsException(String userId, AssetType assetType, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient %s balance for user %s: requested %s",
                        assetType, userId, requested.toPlainString()));
        this.userId = userId;
        this.assetType = assetType;
        this.requested = requested;
    }

    public String getUserId() {
        return userId;
    }

    public AssetType getAssetType() {
        return assetType;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
