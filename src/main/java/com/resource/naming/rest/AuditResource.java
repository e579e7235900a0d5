package com.resource.naming.rest;

import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.OperationResult;
import com.resource.naming.audit.AuditEntry;
import com.resource.naming.rest.dto.AuditEntryResponse;
import com.resource.naming.rest.security.RequiresRole;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
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

import java.util.List;
import java.util.Map;

/**
 * REST resource for the claim/release audit log.
 *
 * <p>Non-administrators only see records they produced, or records of names they claimed
 * or released.</p>
 */
@Path("/api/v1/audit")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Audit", description = "Query claim and release history")
@SecurityRequirement(name = "apiKey")
@RequiresRole(SecurityRole.READER)
public class AuditResource {
    private static final Logger log = LoggerFactory.getLogger(AuditResource.class);
    static final int MAX_AUDIT_LIMIT = 500;

    private final NameClaimService service;
    private final SecurityConfig securityConfig;

    @Inject
    public AuditResource(NameClaimService service, SecurityConfig securityConfig) {
        this.service = service;
        this.securityConfig = securityConfig;
    }

    /**
     * GET /api/v1/audit/{region}/{environment}/{name}
     */
    @GET
    @Path("/{region}/{environment}/{name}")
    @Operation(summary = "Audit trail of a name", description = "Claim and release records of one name, oldest first.")
    @APIResponse(responseCode = "200", description = "Audit trail returned")
    @APIResponse(responseCode = "403", description = "Caller never claimed or released the name")
    @APIResponse(responseCode = "404", description = "Name was never claimed")
    public Response trail(@Parameter(description = "Region code") @PathParam("region") String region,
                          @Parameter(description = "Environment code") @PathParam("environment") String environment,
                          @Parameter(description = "Claimed name") @PathParam("name") String name,
                          @Context SecurityContext securityContext) {
        String path = "/api/v1/audit/" + region + "/" + environment + "/" + name;
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<List<AuditEntry>> result = service.queryAudit(region, environment, name, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            return Response.ok(result.value().stream().map(AuditEntryResponse::from).toList()).build();
        } catch (Exception e) {
            log.error("auditTrail.failed name='{}' error={}", name, e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }

    /**
     * GET /api/v1/audit?actor=&region=&environment=&action=&start=&end=&limit=
     */
    @GET
    @Operation(summary = "Query audit records",
            description = "Filters by actor, region, environment, action and time range, newest first. "
                    + "start and end accept an ISO instant, a local date-time (UTC) or a date.")
    @APIResponse(responseCode = "200", description = "Matching records")
    @APIResponse(responseCode = "400", description = "Malformed filter")
    @APIResponse(responseCode = "403", description = "Filtering by another actor requires ADMIN")
    public Response query(@QueryParam("actor") String actor,
                          @QueryParam("region") String region,
                          @QueryParam("environment") String environment,
                          @Parameter(description = "claimed or released") @QueryParam("action") String action,
                          @QueryParam("start") String start,
                          @QueryParam("end") String end,
                          @QueryParam("limit") @DefaultValue("100") int limit,
                          @Context SecurityContext securityContext) {
        String path = "/api/v1/audit";
        try {
            AuthContext auth = RequestAuth.of(securityContext, securityConfig);
            if (auth == null) {
                return ResultResponses.unauthorized(path);
            }
            OperationResult<List<AuditEntry>> result =
                    service.queryAuditBulk(actor, region, environment, action, start, end, auth);
            if (!result.isSuccess()) {
                return ResultResponses.failure(result.status(), result.message(), path);
            }
            int clampedLimit = Math.min(Math.max(limit, 1), MAX_AUDIT_LIMIT);
            List<AuditEntryResponse> entries = result.value().stream()
                    .limit(clampedLimit)
                    .map(AuditEntryResponse::from)
                    .toList();
            return Response.ok(Map.of(
                    "content", entries,
                    "totalElements", result.value().size(),
                    "limit", clampedLimit
            )).build();
        } catch (Exception e) {
            log.error("auditQuery.failed error={}", e.getMessage(), e);
            return ResultResponses.internalError(path);
        }
    }
}
