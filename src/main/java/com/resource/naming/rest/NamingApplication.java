package com.resource.naming.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;

/**
 * Jakarta RS application for the naming service.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Resource Naming API",
                version = "1.0.0",
                description = "Claim and release unique, policy-compliant cloud resource names. "
                        + "Names are built from layered rules, resource slugs and caller segments, "
                        + "and every claim and release is recorded in an audit log."
        )
)
@SecurityScheme(
        securitySchemeName = "apiKey",
        type = SecuritySchemeType.APIKEY,
        apiKeyName = "X-API-Key",
        in = SecuritySchemeIn.HEADER,
        description = "API key authentication. Each key identifies an actor and a role (READER, CONTRIBUTOR, ADMIN)."
)
public class NamingApplication extends Application {
}
