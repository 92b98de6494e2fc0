package com.flagship.altyn_ledger.identity;

import lombok.Value;

/**
 * What the ledger knows about a user: an opaque id, a display name and the
 * admin capability. Owned by the identity service.
 */
@Value
public class UserProfile {
    String userId;
    String displayName;
    String email;
    boolean admin;
}
