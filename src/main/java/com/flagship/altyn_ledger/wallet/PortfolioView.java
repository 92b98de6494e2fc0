package com.flagship.altyn_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Multi-currency view of a wallet.
 */
@Value
public class PortfolioView {
    String userId;
    String userName;
    BigDecimal coinBalance;
    Map<String, BigDecimal> coinValues;
    BigDecimal tokenBalance;
    BigDecimal tokenPercentage;
    BigDecimal dividendsReceived;
    BigDecimal pendingDividends;
}
