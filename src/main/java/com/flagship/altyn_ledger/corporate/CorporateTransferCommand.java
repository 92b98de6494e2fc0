package com.flagship.altyn_ledger.corporate;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * COIN payment out of an organization's wallet, requested by one of its admins.
 * The recipient is a user ({@code toUserId}) or another organization's wallet
 * ({@code toOrganizationId}); exactly one is set.
 */
@Value
@Builder
public class CorporateTransferCommand {
    String callerId;
    String organizationId;
    String toUserId;
    String toOrganizationId;
    BigDecimal amount;
    String description;
    String idempotencyKey;
}
