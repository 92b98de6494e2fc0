package com.flagship.altyn_ledger.identity;

import com.flagship.altyn_ledger.error.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single capability check for admin-only ledger operations.
 */
@Component
@Slf4j
public class AdminGuard {

    private final UserDirectory userDirectory;

    public AdminGuard(UserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    /**
     * @return the caller's profile when the caller is an admin
     * @throws UnauthorizedException for unknown callers and non-admins alike
     */
    public UserProfile requireAdmin(String callerId, String operation) {
        UserProfile caller = userDirectory.findById(callerId).orElse(null);
        if (caller == null || !caller.isAdmin()) {
            log.warn("Rejected admin operation: operation={}, callerId={}", operation, callerId);
            throw new UnauthorizedException("Admin capability required for " + operation);
        }
        return caller;
    }

    public boolean isAdmin(String callerId) {
        return userDirectory.findById(callerId).map(UserProfile::isAdmin).orElse(false);
    }
}
