package com.resource.naming.rest;

import com.resource.naming.rest.security.ApiPrincipal;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import jakarta.ws.rs.core.SecurityContext;

/**
 * Turns the request's security context into the {@link AuthContext} the service layer expects.
 */
final class RequestAuth {

    private RequestAuth() {
    }

    /**
     * @return the caller, or null when security is enabled and no principal was authenticated
     */
    static AuthContext of(SecurityContext securityContext, SecurityConfig securityConfig) {
        if (securityContext != null && securityContext.getUserPrincipal() instanceof ApiPrincipal principal) {
            return principal.toAuthContext();
        }
        if (!securityConfig.isEnabled()) {
            return AuthContext.of(SecurityConfig.ANONYMOUS_ACTOR, SecurityRole.ADMIN);
        }
        return null;
    }
}
