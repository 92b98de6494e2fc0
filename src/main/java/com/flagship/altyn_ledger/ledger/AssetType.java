package com.flagship.altyn_ledger.ledger;

/**
 * The two asset kinds held in every wallet.
 *
 * COIN is the USD-pegged stable unit used for payments and fees.
 * TOKEN is the equity unit that entitles holders to dividend payouts.
 */
public enum AssetType {
    COIN(2),
    TOKEN(4);

    private final int scale;

    AssetType(int scale) {
        this.scale = scale;
    }

    /**
     * Number of fraction digits the ledger stores for this asset.
     */
    public int getScale() {
        return scale;
    }
}
