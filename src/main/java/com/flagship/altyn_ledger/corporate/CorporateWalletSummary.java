package com.flagship.altyn_ledger.corporate;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One organization the caller administers. {@code coinBalance} is null
 * until the organization opens its wallet.
 */
@Value
public class CorporateWalletSummary {
    String organizationId;
    String organizationName;
    boolean hasWallet;
    BigDecimal coinBalance;
}
