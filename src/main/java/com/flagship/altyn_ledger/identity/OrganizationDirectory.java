package com.flagship.altyn_ledger.identity;

import com.flagship.altyn_ledger.error.NotFoundException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of organizations and of who administers them.
 */
public interface OrganizationDirectory {

    Optional<Organization> findById(String organizationId);

    /**
     * Organizations the user administers, ordered by name.
     */
    List<Organization> findAdministeredBy(String userId);

    boolean isAdmin(String organizationId, String userId);

    /**
     * Names for a batch of ids. Unknown ids are absent from the result.
     */
    Map<String, String> names(Collection<String> organizationIds);

    default Organization require(String organizationId) {
        return findById(organizationId)
            .orElseThrow(() -> new NotFoundException("Organization not found: " + organizationId));
    }
}
