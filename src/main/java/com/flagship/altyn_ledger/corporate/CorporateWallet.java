package com.flagship.altyn_ledger.corporate;

import lombok.Value;

import java.time.Instant;

/**
 * Record that an organization opened its corporate wallet.
 */
@Value
public class CorporateWallet {
    String organizationId;
    String accountId;
    String createdBy;
    Instant createdAt;

    static CorporateWallet open(String organizationId, String createdBy) {
        return new CorporateWallet(organizationId, CorporateAccounts.accountId(organizationId), createdBy, Instant.now());
    }
}
