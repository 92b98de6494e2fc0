package com.flagship.altyn_ledger.identity;

import lombok.Value;

/**
 * An organization that can own a corporate wallet. Owned by the identity service.
 */
@Value
public class Organization {
    String organizationId;
    String name;
}
