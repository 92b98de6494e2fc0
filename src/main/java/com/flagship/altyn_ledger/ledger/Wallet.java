package com.flagship.altyn_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Snapshot of one user's wallet.
 *
 * Balances are never assigned directly; they change only through
 * {@link WalletLedger#credit} and {@link WalletLedger#debit}.
 */
@Value
public class Wallet {
    String userId;
    BigDecimal coinBalance;
    BigDecimal tokenBalance;
    long version;

    /**
     * A wallet that has not been touched yet. Unknown users read as zero balances.
     */
    public static Wallet empty(String userId) {
        return new Wallet(userId, LedgerAmounts.zero(AssetType.COIN), LedgerAmounts.zero(AssetType.TOKEN), 0L);
    }

    public BigDecimal balanceOf(AssetType assetType) {
        return switch (assetType) {
            case COIN -> coinBalance;
            case TOKEN -> tokenBalance;
        };
    }

    public boolean holdsTokens() {
        return tokenBalance.signum() > 0;
    }
}
