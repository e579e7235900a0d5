package com.resource.naming.rest;

import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.NamingEngine;
import com.resource.naming.rest.dto.ClaimNameRequest;
import com.resource.naming.rest.dto.ClaimRecordResponse;
import com.resource.naming.rest.dto.ClaimResponse;
import com.resource.naming.rest.dto.ErrorResponse;
import com.resource.naming.rest.dto.ReleaseNameRequest;
import com.resource.naming.rest.security.ApiPrincipal;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.SecurityRole;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("NameResource")
class NameResourceTest {

    private NamingEngine engine;
    private NameClaimService service;

    @BeforeEach
    void setUp() {
        engine = NamingEngine.builder().build();
        service = engine.service();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    static SecurityContext as(String actor, SecurityRole role) {
        SecurityContext context = mock(SecurityContext.class);
        when(context.getUserPrincipal()).thenReturn(new ApiPrincipal(actor, role));
        return context;
    }

    private static ClaimNameRequest storageAccount() {
        return new ClaimNameRequest("storage_account", "wus2", "prod", Map.of(), Map.of("team", "platform"), null);
    }

    @Nested
    @DisplayName("with security disabled")
    class Anonymous {

        @Test
        @DisplayName("claims as the anonymous actor")
        void claimsAsAnonymous() {
            NameResource resource = new NameResource(service, SecurityConfig.disabled());

            Response response = resource.claim(storageAccount(), null);

            assertEquals(200, response.getStatus());
            ClaimResponse body = (ClaimResponse) response.getEntity();
            assertEquals("org-st-wus2-prod", body.name());
            assertEquals(SecurityConfig.ANONYMOUS_ACTOR, body.claimedBy());
            assertNotNull(body.version());
        }
    }

    @Nested
    @DisplayName("with API keys")
    class Authenticated {

        private NameResource resource;

        @BeforeEach
        void createResource() {
            resource = new NameResource(service, SecurityConfig.builder()
                    .addKey("k1", "alice", SecurityRole.CONTRIBUTOR)
                    .build());
        }

        @Test
        void claimThenConflict() {
            assertEquals(200, resource.claim(storageAccount(), as("alice", SecurityRole.CONTRIBUTOR)).getStatus());

            Response second = resource.claim(storageAccount(), as("bob", SecurityRole.CONTRIBUTOR));

            assertEquals(409, second.getStatus());
            ErrorResponse error = (ErrorResponse) second.getEntity();
            assertEquals("/api/v1/names/claim", error.path());
            assertTrue(error.message().contains("already in use"));
        }

        @Test
        void missingBodyIsBadRequest() {
            assertEquals(400, resource.claim(null, as("alice", SecurityRole.CONTRIBUTOR)).getStatus());
            assertEquals(400, resource.release(null, as("alice", SecurityRole.CONTRIBUTOR)).getStatus());
        }

        @Test
        void missingPrincipalIsUnauthorized() {
            assertEquals(401, resource.claim(storageAccount(), null).getStatus());
            assertEquals(401, resource.getClaim("wus2", "prod", "x", mock(SecurityContext.class)).getStatus());
        }

        @Test
        void invalidPayloadIsBadRequest() {
            ClaimNameRequest request = new ClaimNameRequest("storage_account", null, "prod", null, null, null);
            assertEquals(400, resource.claim(request, as("alice", SecurityRole.CONTRIBUTOR)).getStatus());
        }

        @Test
        void unknownSlugIsNotFound() {
            ClaimNameRequest request = new ClaimNameRequest("flux_capacitor", "wus2", "prod", null, null, null);
            assertEquals(404, resource.claim(request, as("alice", SecurityRole.CONTRIBUTOR)).getStatus());
        }

        @Test
        void readThenReleaseWithVersion() {
            resource.claim(storageAccount(), as("alice", SecurityRole.CONTRIBUTOR));
            Response read = resource.getClaim("wus2", "prod", "org-st-wus2-prod", as("carol", SecurityRole.READER));
            assertEquals(200, read.getStatus());
            ClaimRecordResponse row = (ClaimRecordResponse) read.getEntity();
            assertTrue(row.inUse());

            Response released = resource.release(new ReleaseNameRequest("wus2", "prod", row.name(),
                    "done", row.version()), as("alice", SecurityRole.CONTRIBUTOR));

            assertEquals(200, released.getStatus());
            ClaimRecordResponse after = (ClaimRecordResponse) released.getEntity();
            assertFalse(after.inUse());
            assertEquals("done", after.releaseReason());
            assertNotEquals(row.version(), after.version());

            Response stale = resource.release(new ReleaseNameRequest("wus2", "prod", row.name(),
                    "again", row.version()), as("alice", SecurityRole.CONTRIBUTOR));
            assertEquals(409, stale.getStatus());
        }

        @Test
        void releaseByStrangerIsForbidden() {
            resource.claim(storageAccount(), as("alice", SecurityRole.CONTRIBUTOR));
            Response response = resource.release(new ReleaseNameRequest("wus2", "prod", "org-st-wus2-prod",
                    null, "1"), as("bob", SecurityRole.CONTRIBUTOR));
            assertEquals(403, response.getStatus());
        }

        @Test
        void unknownNameIsNotFound() {
            assertEquals(404, resource.getClaim("wus2", "prod", "nope", as("carol", SecurityRole.READER)).getStatus());
        }
    }

    @Test
    @DisplayName("unexpected failures answer a generic 500")
    void unexpectedFailureIsInternalError() {
        NameClaimService failing = mock(NameClaimService.class);
        when(failing.claim(any(), any())).thenThrow(new IllegalStateException("ledger exploded"));
        NameResource resource = new NameResource(failing, SecurityConfig.disabled());

        Response response = resource.claim(storageAccount(), null);

        assertEquals(500, response.getStatus());
        ErrorResponse error = (ErrorResponse) response.getEntity();
        assertEquals(ResultResponses.INTERNAL_ERROR_MESSAGE, error.message());
        assertFalse(error.message().contains("exploded"));
    }

    @Test
    void dtoValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ClaimNameRequest(" ", "wus2", "prod", null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new ReleaseNameRequest("wus2", "prod", null, null, null));
        assertEquals("7", new ReleaseNameRequest("wus2", "prod", "n", null, "7")
                .toReleaseRequest().expectedVersion().value());
    }

    @Test
    @DisplayName("a release body without expectedVersion is rejected")
    void releaseRequiresVersion() {
        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> new ReleaseNameRequest("wus2", "prod", "org-st-wus2-prod", "done", null));
        assertTrue(missing.getMessage().contains("expectedVersion"));
        assertThrows(IllegalArgumentException.class,
                () -> new ReleaseNameRequest("wus2", "prod", "org-st-wus2-prod", "done", " "));
    }
}
