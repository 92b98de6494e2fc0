package com.flagship.altyn_ledger.api;

import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.observability.CorrelationContext;
import org.springframework.stereotype.Component;

/**
 * Resolves the X-User-Id header set by the auth gateway into a known user.
 */
@Component
public class CallerResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final UserDirectory userDirectory;

    public CallerResolver(UserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    /**
     * @throws com.flagship.altyn_ledger.error.NotFoundException if the caller is unknown
     */
    public UserProfile resolve(String userId) {
        UserProfile caller = userDirectory.require(userId);
        CorrelationContext.setUserId(caller.getUserId());
        return caller;
    }
}
