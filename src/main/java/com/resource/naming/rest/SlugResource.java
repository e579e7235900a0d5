package com.resource.naming.rest;

import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.OperationResult;
import com.resource.naming.api.SlugLookup;
import com.resource.naming.rest.dto.SlugSyncResponse;
import com.resource.naming.rest.security.RequiresRole;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import com.resource.naming.slug.SlugSyncService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for resource type slugs.
 */
@Path("/api/v1/slugs")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Slugs", description = "Look up and synchronize resource type abbreviations")
@SecurityRequirement(name = "apiKey")
public class SlugResource {
    private static final Logger log = LoggerFactory.getLogger(SlugResource.class);

    private final NameClaimService service;
    private final SecurityConfig securityConfig;

    @Inject
    public SlugResource(NameClaimService service, SecurityConfig securityConfig) {
        this.service = service;
        this.securityConfig = securityConfig;
    }

    /**
     * GET /api/v1/slugs?resourceType=storage_account
     */
    @GET
    @RequiresRole(SecurityRole.READER)
    @Operation(summary = "Look up a slug",
            description = "Resolves a resource type, or its full name with spaces, to its slug.")
    @APIResponse(responseCode = "200", description = "Slug found")
    @APIResponse(responseCode = "400", description = "Resource type missing or too long")
    @APIResponse(responseCode = "404", description = "No slug for the resource type")
    public Response lookup(@Parameter(description = "Resource type or full name") @QueryParam("resourceType") String resourceType,
                           @Context SecurityContext securityContext) {
        String path = "/api/v1/slugs";
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<SlugLookup> result = service.lookupSlug(resourceType, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(result.value()).build();
        } catch (Exception e) {
            log.error("lookupSlug.failed resourceType='{}' error={}", resourceType, e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }

    /**
     * POST /api/v1/slugs/sync with the upstream definitions file as the body.
     */
    @POST
    @Path("/sync")
    @Consumes(MediaType.TEXT_PLAIN)
    @RequiresRole(SecurityRole.ADMIN)
    @Operation(summary = "Synchronize slugs",
            description = "Parses an upstream naming-definitions snapshot and upserts its slugs.")
    @APIResponse(responseCode = "200", description = "Slug table updated")
    @APIResponse(responseCode = "502", description = "Snapshot could not be parsed")
    @APIResponse(responseCode = "403", description = "Insufficient permissions (requires ADMIN)")
    public Response sync(String snapshot, @Context SecurityContext securityContext) {
        String path = "/api/v1/slugs/sync";
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<SlugSyncService.SyncSummary> result = service.syncSlugs(snapshot, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(SlugSyncResponse.from(result.value())).build();
        } catch (Exception e) {
            log.error("syncSlugs.failed error={}", e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }
}
