package com.resource.naming.rest;

import com.resource.naming.api.ClaimResult;
import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.OperationResult;
import com.resource.naming.api.ReleaseResult;
import com.resource.naming.api.ResultWarning;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.rest.dto.ClaimNameRequest;
import com.resource.naming.rest.dto.ClaimRecordResponse;
import com.resource.naming.rest.dto.ClaimResponse;
import com.resource.naming.rest.dto.ReleaseNameRequest;
import com.resource.naming.rest.security.RequiresRole;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
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
 * REST resource for claiming, releasing and reading names.
 *
 * <p>Security: claim and release require {@link SecurityRole#CONTRIBUTOR}; releasing a name
 * claimed by someone else additionally requires {@link SecurityRole#ADMIN}, which the
 * service checks.</p>
 */
@Path("/api/v1/names")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Names", description = "Claim, release and read resource names")
@SecurityRequirement(name = "apiKey")
public class NameResource {
    private static final Logger log = LoggerFactory.getLogger(NameResource.class);

    private final NameClaimService service;
    private final SecurityConfig securityConfig;

    @Inject
    public NameResource(NameClaimService service, SecurityConfig securityConfig) {
        this.service = service;
        this.securityConfig = securityConfig;
    }

    /**
     * POST /api/v1/names/claim
     */
    @POST
    @Path("/claim")
    @RequiresRole(SecurityRole.CONTRIBUTOR)
    @Operation(summary = "Claim a name",
            description = "Builds a name from the rules of the resource type and records it as in use. "
                    + "When the rule has an index segment and none is given, the next free index is tried.")
    @APIResponse(responseCode = "200", description = "Name claimed")
    @APIResponse(responseCode = "400", description = "Invalid payload or the built name breaks a rule")
    @APIResponse(responseCode = "404", description = "No slug known for the resource type")
    @APIResponse(responseCode = "409", description = "Name already in use")
    @APIResponse(responseCode = "403", description = "Insufficient permissions (requires CONTRIBUTOR)")
    public Response claim(ClaimNameRequest request, @Context SecurityContext securityContext) {
        String path = "/api/v1/names/claim";
        if (request == null) {
            return ResultResponses.badRequest("Request body is required", path);
        }
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            ClaimResult result = service.claim(request.toClaimRequest(), auth);
            if (!result.isClaimed()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(ClaimResponse.from(result)).build();
        } catch (Exception e) {
            log.error("claim.failed resourceType='{}' error={}", request.resourceType(), e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }

    /**
     * POST /api/v1/names/release
     */
    @POST
    @Path("/release")
    @RequiresRole(SecurityRole.CONTRIBUTOR)
    @Operation(summary = "Release a name",
            description = "Marks a claimed name as free. expectedVersion must be the version from the last read; "
                    + "a release of any other version is rejected.")
    @APIResponse(responseCode = "200", description = "Name released")
    @APIResponse(responseCode = "400", description = "expectedVersion missing")
    @APIResponse(responseCode = "403", description = "Caller is not the claimant and not an administrator")
    @APIResponse(responseCode = "404", description = "Name was never claimed")
    @APIResponse(responseCode = "409", description = "Name changed since it was read")
    public Response release(ReleaseNameRequest request, @Context SecurityContext securityContext) {
        String path = "/api/v1/names/release";
        if (request == null) {
            return ResultResponses.badRequest("Request body is required", path);
        }
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            ReleaseResult result = service.release(request.toReleaseRequest(), auth);
            if (!result.isReleased()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(ClaimRecordResponse.from(result.claim(), result.version(),
                    result.warnings().stream().map(ResultWarning::name).toList())).build();
        } catch (IllegalArgumentException e) {
            return ResultResponses.badRequest(e.getMessage(), path);
        } catch (Exception e) {
            log.error("release.failed name='{}' error={}", request.name(), e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }

    /**
     * GET /api/v1/names/{region}/{environment}/{name}
     */
    @GET
    @Path("/{region}/{environment}/{name}")
    @RequiresRole(SecurityRole.READER)
    @Operation(summary = "Get a name", description = "Returns the ledger row of a name and its current version.")
    @APIResponse(responseCode = "200", description = "Name found")
    @APIResponse(responseCode = "404", description = "Name was never claimed")
    public Response getClaim(@Parameter(description = "Region code") @PathParam("region") String region,
                             @Parameter(description = "Environment code") @PathParam("environment") String environment,
                             @Parameter(description = "Claimed name") @PathParam("name") String name,
                             @Context SecurityContext securityContext) {
        String path = "/api/v1/names/" + region + "/" + environment + "/" + name;
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<VersionedClaim> result = service.getClaim(region, environment, name, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(ClaimRecordResponse.from(result.value())).build();
        } catch (Exception e) {
            log.error("getClaim.failed name='{}' error={}", name, e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }
}
