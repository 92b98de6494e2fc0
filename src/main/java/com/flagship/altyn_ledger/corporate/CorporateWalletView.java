package com.flagship.altyn_ledger.corporate;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * An organization's wallet as seen by one caller.
 * {@code callerIsAdmin} tells the caller whether it may move the funds.
 */
@Value
public class CorporateWalletView {
    String organizationId;
    String organizationName;
    String accountId;
    BigDecimal coinBalance;
    Map<String, BigDecimal> coinValues;
    boolean callerIsAdmin;
    String createdBy;
    Instant createdAt;
}
