package com.resource.naming.rest;

import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.OperationResult;
import com.resource.naming.rest.dto.DefaultsRequest;
import com.resource.naming.rest.security.RequiresRole;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
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

import java.util.Map;

/**
 * REST resource for the caller's claim defaults (region, environment and optional segments).
 */
@Path("/api/v1/settings/defaults")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Settings", description = "Per-user and per-session claim defaults")
@SecurityRequirement(name = "apiKey")
public class SettingsResource {
    private static final Logger log = LoggerFactory.getLogger(SettingsResource.class);
    private static final String PATH = "/api/v1/settings/defaults";

    private final NameClaimService service;
    private final SecurityConfig securityConfig;

    @Inject
    public SettingsResource(NameClaimService service, SecurityConfig securityConfig) {
        this.service = service;
        this.securityConfig = securityConfig;
    }

    @GET
    @RequiresRole(SecurityRole.READER)
    @Operation(summary = "Get defaults", description = "Effective defaults; session values override permanent ones.")
    public Response get(@QueryParam("sessionId") String sessionId, @Context SecurityContext securityContext) {
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(PATH);
            }
            OperationResult<Map<String, String>> result = service.getDefaults(sessionId, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), PATH);
            }
            return Response.ok(result.value()).build();
        } catch (Exception e) {
            log.error("getDefaults.failed error={}", e.getMessage(), e);
            return ResultResponses.internalError(PATH);
        }
    }

    @PUT
    @RequiresRole(SecurityRole.CONTRIBUTOR)
    @Operation(summary = "Save defaults",
            description = "Stores permanent defaults, or session defaults when sessionId is given.")
    @APIResponse(responseCode = "200", description = "Defaults saved; the effective defaults are returned")
    @APIResponse(responseCode = "400", description = "Unsupported key or invalid value")
    public Response save(DefaultsRequest request, @Context SecurityContext securityContext) {
        if (request == null) {
            return ResultResponses.badRequest("Request body is required", PATH);
        }
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(PATH);
            }
            OperationResult<Map<String, String>> result =
                    service.saveDefaults(request.sessionId(), request.values(), auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), PATH);
            }
            return Response.ok(result.value()).build();
        } catch (Exception e) {
            log.error("saveDefaults.failed error={}", e.getMessage(), e);
            return ResultResponses.internalError(PATH);
        }
    }
}
