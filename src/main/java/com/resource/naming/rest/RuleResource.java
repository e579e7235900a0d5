package com.resource.naming.rest;

import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.OperationResult;
import com.resource.naming.rest.security.RequiresRole;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.rules.RuleDescription;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * REST resource for rule discovery.
 */
@Path("/api/v1/rules")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Rules", description = "Discover naming rules per resource type")
@SecurityRequirement(name = "apiKey")
@RequiresRole(SecurityRole.READER)
public class RuleResource {
    private static final Logger log = LoggerFactory.getLogger(RuleResource.class);

    private final NameClaimService service;
    private final SecurityConfig securityConfig;

    @Inject
    public RuleResource(NameClaimService service, SecurityConfig securityConfig) {
        this.service = service;
        this.securityConfig = securityConfig;
    }

    @GET
    @Operation(summary = "List resource types", description = "Resource types with an explicit rule, sorted.")
    public Response list(@Context SecurityContext securityContext) {
        String path = "/api/v1/rules";
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<List<String>> result = service.listResourceTypes(auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(result.value()).build();
        } catch (Exception e) {
            log.error("listRules.failed error={}", e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }

    @GET
    @Path("/{resourceType}")
    @Operation(summary = "Describe a rule",
            description = "Effective rule of a resource type: segments, templates, display fields and payload inputs.")
    @APIResponse(responseCode = "200", description = "Rule described")
    @APIResponse(responseCode = "400", description = "Resource type cannot be normalized")
    public Response describe(@PathParam("resourceType") String resourceType,
                             @Context SecurityContext securityContext) {
        String path = "/api/v1/rules/" + resourceType;
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<RuleDescription> result = service.describeRule(resourceType, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(result.value()).build();
        } catch (Exception e) {
            log.error("describeRule.failed resourceType='{}' error={}", resourceType, e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }
}
