package com.flagship.altyn_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A user's balances with their equity share and projected dividend.
 */
@Value
public class WalletView {
    String userId;
    String userName;
    BigDecimal coinBalance;
    BigDecimal tokenBalance;
    BigDecimal tokenPercentage;
    BigDecimal pendingDividends;
}
