package com.flagship.altyn_ledger.corporate;

/**
 * Ledger account ids of corporate wallets. An organization's COIN balance is
 * held in the ordinary wallet store under {@code org:<organizationId>}, so
 * transfers, fees and reconciliation treat it like any other account.
 */
public final class CorporateAccounts {

    public static final String PREFIX = "org:";

    private CorporateAccounts() {
    }

    public static String accountId(String organizationId) {
        return PREFIX + organizationId;
    }

    public static boolean isCorporate(String accountId) {
        return accountId != null && accountId.startsWith(PREFIX);
    }

    public static String organizationId(String accountId) {
        if (!isCorporate(accountId)) {
            throw new IllegalArgumentException("Not a corporate account: " + accountId);
        }
        return accountId.substring(PREFIX.length());
    }
}
