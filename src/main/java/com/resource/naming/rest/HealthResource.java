package com.resource.naming.rest;

import com.resource.naming.api.NamingEngine;
import com.resource.naming.health.HealthStatus;
import com.resource.naming.rest.security.RequiresRole;
import com.resource.naming.security.SecurityRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Aggregate health of the rule store, the claim ledger and FalkorDB.
 */
@Path("/api/v1/health")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Health", description = "Service health")
@SecurityRequirement(name = "apiKey")
public class HealthResource {

    private final NamingEngine engine;

    @Inject
    public HealthResource(NamingEngine engine) {
        this.engine = engine;
    }

    @GET
    @RequiresRole(SecurityRole.READER)
    @Operation(summary = "Health", description = "UP and DEGRADED answer 200, DOWN answers 503.")
    @APIResponse(responseCode = "200", description = "Service is usable")
    @APIResponse(responseCode = "503", description = "A required component is down")
    public Response health() {
        HealthStatus status = engine.health();
        int code = status.isDown() ? Response.Status.SERVICE_UNAVAILABLE.getStatusCode() : Response.Status.OK.getStatusCode();
        return Response.status(code).entity(status).build();
    }
}
