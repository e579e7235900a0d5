package com.resource.naming.rest.security;

import com.resource.naming.security.SecurityRole;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;

/**
 * Jakarta RS filter that enforces role-based access control.
 *
 * <p>Inspects the {@link RequiresRole} annotation on the matched resource method
 * (or its class) and compares it against the principal set by {@link ApiKeyAuthFilter}.
 * Returns {@code 403 Forbidden} if the caller's role is insufficient.</p>
 *
 * <p>Ownership rules (who may release or audit a given name) are checked by the
 * service layer, not here.</p>
 */
@Provider
@Priority(Priorities.AUTHORIZATION)
public class RoleAuthorizationFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RoleAuthorizationFilter.class);

    private final SecurityConfig securityConfig;

    @Context
    private ResourceInfo resourceInfo;

    public RoleAuthorizationFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    public RoleAuthorizationFilter(SecurityConfig securityConfig, ResourceInfo resourceInfo) {
        this.securityConfig = securityConfig;
        this.resourceInfo = resourceInfo;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }

        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            return;
        }

        RequiresRole annotation = resolveAnnotation();
        if (annotation == null) {
            return;
        }

        SecurityRole requiredRole = annotation.value();
        ApiPrincipal principal = (ApiPrincipal) requestContext.getProperty(ApiKeyAuthFilter.PRINCIPAL_PROPERTY);

        if (principal == null) {
            log.warn("authz.rejected reason=no_principal path={}", requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.FORBIDDEN)
                    .entity(new ApiKeyAuthFilter.ErrorBody("FORBIDDEN", "Access denied."))
                    .build());
            return;
        }

        if (!principal.role().hasPermission(requiredRole)) {
            log.warn("authz.rejected actor={} callerRole={} requiredRole={} path={}",
                    principal.actor(), principal.role(), requiredRole, requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.FORBIDDEN)
                    .entity(new ApiKeyAuthFilter.ErrorBody("FORBIDDEN",
                            "Insufficient permissions. Required role: " + requiredRole))
                    .build());
            return;
        }

        log.debug("authz.success actor={} requiredRole={} path={}",
                principal.actor(), requiredRole, requestContext.getUriInfo().getPath());
    }

    /**
     * Method-level annotations take precedence over class-level.
     */
    private RequiresRole resolveAnnotation() {
        if (resourceInfo == null) {
            return null;
        }

        Method method = resourceInfo.getResourceMethod();
        if (method != null) {
            RequiresRole methodAnnotation = method.getAnnotation(RequiresRole.class);
            if (methodAnnotation != null) {
                return methodAnnotation;
            }
        }

        Class<?> resourceClass = resourceInfo.getResourceClass();
        if (resourceClass != null) {
            return resourceClass.getAnnotation(RequiresRole.class);
        }

        return null;
    }
}
