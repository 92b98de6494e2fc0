package com.flagship.altyn_ledger.treasury;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Conservation check over the whole ledger at one consistent snapshot.
 *
 * COIN: wallets + collected fees = circulation = all COIN ever emitted, and
 * collected fees = fees ever charged - dividends ever paid.
 * TOKEN: wallets = supply = all TOKEN ever issued.
 */
@Value
@Builder
public class ReconciliationReport {
    BigDecimal coinWalletTotal;
    BigDecimal collectedFees;
    BigDecimal totalCoinsInCirculation;
    BigDecimal coinsEmitted;
    BigDecimal feesCharged;
    BigDecimal dividendsPaid;
    BigDecimal tokenWalletTotal;
    BigDecimal totalTokenSupply;
    BigDecimal tokensIssued;
    Instant checkedAt;

    /**
     * circulation - (wallets + fees); zero when balanced.
     */
    public BigDecimal getCoinDiscrepancy() {
        return totalCoinsInCirculation.subtract(coinWalletTotal.add(collectedFees));
    }

    public BigDecimal getTokenDiscrepancy() {
        return totalTokenSupply.subtract(tokenWalletTotal);
    }

    public boolean isBalanced() {
        return getCoinDiscrepancy().signum() == 0
                && totalCoinsInCirculation.compareTo(coinsEmitted) == 0
                && collectedFees.compareTo(feesCharged.subtract(dividendsPaid)) == 0
                && getTokenDiscrepancy().signum() == 0
                && totalTokenSupply.compareTo(tokensIssued) == 0;
    }
}
