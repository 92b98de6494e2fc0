package com.flagship.altyn_ledger.identity;

import com.flagship.altyn_ledger.error.NotFoundException;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of users owned by the identity collaborator.
 */
public interface UserDirectory {

    Optional<UserProfile> findById(String userId);

    Optional<UserProfile> findByEmail(String email);

    /**
     * Display names for a batch of ids. Unknown ids are absent from the result.
     */
    Map<String, String> displayNames(Collection<String> userIds);

    default UserProfile require(String userId) {
        return findById(userId)
            .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    default UserProfile requireByEmail(String email) {
        return findByEmail(email)
            .orElseThrow(() -> new NotFoundException("User not found: " + email));
    }
}
