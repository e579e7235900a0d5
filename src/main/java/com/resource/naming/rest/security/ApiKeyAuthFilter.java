package com.resource.naming.rest.security;

import com.resource.naming.security.SecurityRole;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Principal;

/**
 * Jakarta RS filter that authenticates requests using API keys.
 *
 * <p>Reads the API key from the configured header (default: {@code X-API-Key}),
 * resolves it to an {@link ApiPrincipal} through {@link SecurityConfig}, and installs
 * a {@link SecurityContext} whose user principal is that principal.</p>
 *
 * <p>Returns {@code 401 Unauthorized} for missing or invalid keys when security is enabled.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyAuthFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

    /** Context property key for the authenticated principal. */
    public static final String PRINCIPAL_PROPERTY = "naming.security.principal";

    private final SecurityConfig securityConfig;

    public ApiKeyAuthFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }

        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            return;
        }

        String apiKey = requestContext.getHeaderString(securityConfig.getApiKeyHeader());

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("auth.rejected reason=missing_api_key path={}", requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .entity(new ErrorBody("UNAUTHORIZED",
                            "Missing API key. Provide a valid key in the '"
                                    + securityConfig.getApiKeyHeader() + "' header."))
                    .build());
            return;
        }

        ApiPrincipal principal = securityConfig.getPrincipalForKey(apiKey);

        if (principal == null) {
            log.warn("auth.rejected reason=invalid_api_key key={} path={}",
                    maskKey(apiKey), requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .entity(new ErrorBody("UNAUTHORIZED", "Invalid API key."))
                    .build());
            return;
        }

        requestContext.setProperty(PRINCIPAL_PROPERTY, principal);

        final boolean secure = requestContext.getSecurityContext() != null
                && requestContext.getSecurityContext().isSecure();
        requestContext.setSecurityContext(new SecurityContext() {
            @Override
            public Principal getUserPrincipal() {
                return principal;
            }

            @Override
            public boolean isUserInRole(String roleName) {
                try {
                    return principal.role().hasPermission(SecurityRole.fromString(roleName));
                } catch (IllegalArgumentException e) {
                    return false;
                }
            }

            @Override
            public boolean isSecure() {
                return secure;
            }

            @Override
            public String getAuthenticationScheme() {
                return "API-KEY";
            }
        });

        log.debug("auth.success actor={} role={} path={}",
                principal.actor(), principal.role(), requestContext.getUriInfo().getPath());
    }

    static String maskKey(String key) {
        if (key.length() <= 8) {
            return "****";
        }
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }

    /**
     * Minimal error body for auth failures.
     */
    public record ErrorBody(String error, String message) {}
}
