package com.resource.naming.rest.security;

import com.resource.naming.error.ConfigurationException;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the security infrastructure: config, principal, auth filter and authorization filter.
 */
@DisplayName("REST Security")
class SecurityTest {

    // ══════════════════════════════════════════════════════════
    //  SecurityConfig
    // ══════════════════════════════════════════════════════════

    @Nested
    @DisplayName("SecurityConfig")
    class SecurityConfigTest {

        @Test
        @DisplayName("builder maps keys to actor and role")
        void builderCreatesConfig() {
            SecurityConfig config = SecurityConfig.builder()
                    .enabled(true)
                    .apiKeyHeader("X-API-Key")
                    .addKey("admin-key", "ops", SecurityRole.ADMIN)
                    .addKey("contrib-key", "Alice", SecurityRole.CONTRIBUTOR)
                    .addKey("reader-key", "dashboard", SecurityRole.READER)
                    .build();

            assertTrue(config.isEnabled());
            assertEquals("X-API-Key", config.getApiKeyHeader());
            assertEquals(3, config.keyCount());
            assertEquals(new ApiPrincipal("ops", SecurityRole.ADMIN), config.getPrincipalForKey("admin-key"));
            assertEquals("alice", config.getPrincipalForKey("contrib-key").actor());
            assertEquals(SecurityRole.READER, config.getPrincipalForKey("reader-key").role());
        }

        @Test
        @DisplayName("unknown, null and blank keys have no principal")
        void unknownKeyReturnsNull() {
            SecurityConfig config = SecurityConfig.builder()
                    .addKey("known-key", "ops", SecurityRole.ADMIN)
                    .build();

            assertNull(config.getPrincipalForKey("unknown-key"));
            assertNull(config.getPrincipalForKey(null));
            assertNull(config.getPrincipalForKey(""));
            assertTrue(config.isValidKey("known-key"));
            assertFalse(config.isValidKey(null));
        }

        @Test
        @DisplayName("addKeys parses actor:key entries")
        void addKeysParsesEntries() {
            SecurityConfig config = SecurityConfig.builder()
                    .addKeys(List.of("alice:key-1", " bob : key-2 ", ""), SecurityRole.CONTRIBUTOR)
                    .build();

            assertEquals(2, config.keyCount());
            assertEquals("alice", config.getPrincipalForKey("key-1").actor());
            assertEquals("bob", config.getPrincipalForKey("key-2").actor());
        }

        @Test
        @DisplayName("addKeys rejects entries without an actor or key")
        void addKeysRejectsMalformedEntries() {
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().addKeys(List.of("no-separator"), SecurityRole.READER));
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().addKeys(List.of(":key"), SecurityRole.READER));
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().addKeys(List.of("actor:"), SecurityRole.READER));
        }

        @Test
        @DisplayName("builder rejects null/blank key, actor and role")
        void rejectsInvalidEntries() {
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().addKey(null, "ops", SecurityRole.ADMIN));
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().addKey("key", " ", SecurityRole.ADMIN));
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().addKey("key", "ops", null));
            assertThrows(IllegalArgumentException.class,
                    () -> SecurityConfig.builder().apiKeyHeader(""));
        }

        @Test
        @DisplayName("actors the audit filter would refuse fail at startup")
        void rejectsActorsOutsideFormat() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> SecurityConfig.builder().addKey("key", "Jane Doe", SecurityRole.CONTRIBUTOR));
            assertTrue(e.getMessage().contains("Jane Doe"));
            assertThrows(ConfigurationException.class,
                    () -> SecurityConfig.builder().addKeys(List.of("ci/deploy:key-1"), SecurityRole.CONTRIBUTOR));

            SecurityConfig config = SecurityConfig.builder()
                    .addKey("key", "Jane.Doe@Corp", SecurityRole.CONTRIBUTOR)
                    .build();
            assertEquals("jane.doe@corp", config.getPrincipalForKey("key").toAuthContext().actor());
        }

        @Test
        @DisplayName("disabled factory creates disabled config")
        void disabledConfig() {
            SecurityConfig config = SecurityConfig.disabled();
            assertFalse(config.isEnabled());
            assertEquals(0, config.keyCount());
        }

        @Test
        @DisplayName("toString never prints keys")
        void toStringHidesKeys() {
            SecurityConfig config = SecurityConfig.builder().addKey("secret-key", "ops", SecurityRole.ADMIN).build();
            assertFalse(config.toString().contains("secret-key"));
        }
    }

    // ══════════════════════════════════════════════════════════
    //  ApiPrincipal
    // ══════════════════════════════════════════════════════════

    @Nested
    @DisplayName("ApiPrincipal")
    class ApiPrincipalTest {

        @Test
        void convertsToAuthContext() {
            AuthContext auth = new ApiPrincipal("Alice", SecurityRole.CONTRIBUTOR).toAuthContext();

            assertEquals("alice", auth.actor());
            assertTrue(auth.hasRole(SecurityRole.READER));
            assertFalse(auth.isElevated());
        }

        @Test
        void rejectsBlankActor() {
            assertThrows(IllegalArgumentException.class, () -> new ApiPrincipal(" ", SecurityRole.READER));
            assertThrows(IllegalArgumentException.class, () -> new ApiPrincipal("Jane Doe", SecurityRole.READER));
        }
    }

    // ══════════════════════════════════════════════════════════
    //  ApiKeyAuthFilter
    // ══════════════════════════════════════════════════════════

    @Nested
    @DisplayName("ApiKeyAuthFilter")
    class ApiKeyAuthFilterTest {

        private final SecurityConfig config = SecurityConfig.builder()
                .addKey("valid-key", "alice", SecurityRole.CONTRIBUTOR)
                .build();

        @Test
        @DisplayName("passes through when security is disabled")
        void passesWhenDisabled() {
            ApiKeyAuthFilter filter = new ApiKeyAuthFilter(SecurityConfig.disabled());
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
            verify(ctx, never()).setSecurityContext(any());
        }

        @Test
        @DisplayName("passes through OPTIONS preflight")
        void passesOptionsRequest() {
            ApiKeyAuthFilter filter = new ApiKeyAuthFilter(config);
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);
            when(ctx.getMethod()).thenReturn("OPTIONS");

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
        }

        @Test
        @DisplayName("rejects request with missing API key")
        void rejectsMissingKey() {
            ApiKeyAuthFilter filter = new ApiKeyAuthFilter(config);
            ContainerRequestContext ctx = mockRequestContext("POST", null);

            filter.filter(ctx);

            verify(ctx).abortWith(argThat(response ->
                    response.getStatus() == Response.Status.UNAUTHORIZED.getStatusCode()));
        }

        @Test
        @DisplayName("rejects request with invalid API key")
        void rejectsInvalidKey() {
            ApiKeyAuthFilter filter = new ApiKeyAuthFilter(config);
            ContainerRequestContext ctx = mockRequestContext("GET", "wrong-key");

            filter.filter(ctx);

            verify(ctx).abortWith(argThat(response ->
                    response.getStatus() == Response.Status.UNAUTHORIZED.getStatusCode()));
        }

        @Test
        @DisplayName("installs principal and security context for a valid key")
        void setsSecurityContext() {
            ApiKeyAuthFilter filter = new ApiKeyAuthFilter(config);
            ContainerRequestContext ctx = mockRequestContext("GET", "valid-key");

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
            verify(ctx).setProperty(ApiKeyAuthFilter.PRINCIPAL_PROPERTY,
                    new ApiPrincipal("alice", SecurityRole.CONTRIBUTOR));
            ArgumentCaptor<SecurityContext> captor = ArgumentCaptor.forClass(SecurityContext.class);
            verify(ctx).setSecurityContext(captor.capture());
            SecurityContext installed = captor.getValue();
            assertEquals("alice", installed.getUserPrincipal().getName());
            assertTrue(installed.isUserInRole("reader"));
            assertTrue(installed.isUserInRole("CONTRIBUTOR"));
            assertFalse(installed.isUserInRole("admin"));
            assertFalse(installed.isUserInRole("superuser"));
            assertEquals("API-KEY", installed.getAuthenticationScheme());
        }

        @Test
        @DisplayName("masks keys in logs")
        void masksKeys() {
            assertEquals("****", ApiKeyAuthFilter.maskKey("short"));
            assertEquals("nm-a****7890", ApiKeyAuthFilter.maskKey("nm-ak-1234567890"));
        }
    }

    // ══════════════════════════════════════════════════════════
    //  RoleAuthorizationFilter
    // ══════════════════════════════════════════════════════════

    @Nested
    @DisplayName("RoleAuthorizationFilter")
    class RoleAuthorizationFilterTest {

        private final SecurityConfig config = SecurityConfig.builder()
                .addKey("key", "ops", SecurityRole.ADMIN)
                .build();

        @Test
        @DisplayName("passes when security is disabled")
        void passesWhenDisabled() {
            RoleAuthorizationFilter filter = new RoleAuthorizationFilter(SecurityConfig.disabled());
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
        }

        @Test
        @DisplayName("passes when no RequiresRole annotation")
        void passesWithNoAnnotation() throws Exception {
            RoleAuthorizationFilter filter = new RoleAuthorizationFilter(config,
                    resourceInfo(UnprotectedEndpoint.class, "open"));
            ContainerRequestContext ctx = mockRequestContext("GET", null);

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
        }

        @Test
        @DisplayName("rejects when caller role is insufficient")
        void rejectsInsufficientRole() throws Exception {
            RoleAuthorizationFilter filter = new RoleAuthorizationFilter(config,
                    resourceInfo(ProtectedEndpoint.class, "adminOnly"));
            ContainerRequestContext ctx = mockRequestContext("POST", null);
            when(ctx.getProperty(ApiKeyAuthFilter.PRINCIPAL_PROPERTY))
                    .thenReturn(new ApiPrincipal("alice", SecurityRole.CONTRIBUTOR));

            filter.filter(ctx);

            verify(ctx).abortWith(argThat(response ->
                    response.getStatus() == Response.Status.FORBIDDEN.getStatusCode()));
        }

        @Test
        @DisplayName("rejects when no principal was authenticated")
        void rejectsWithoutPrincipal() throws Exception {
            RoleAuthorizationFilter filter = new RoleAuthorizationFilter(config,
                    resourceInfo(ProtectedEndpoint.class, "contributorEndpoint"));
            ContainerRequestContext ctx = mockRequestContext("POST", null);

            filter.filter(ctx);

            verify(ctx).abortWith(argThat(response ->
                    response.getStatus() == Response.Status.FORBIDDEN.getStatusCode()));
        }

        @Test
        @DisplayName("passes when caller role is sufficient")
        void passesSufficientRole() throws Exception {
            RoleAuthorizationFilter filter = new RoleAuthorizationFilter(config,
                    resourceInfo(ProtectedEndpoint.class, "contributorEndpoint"));
            ContainerRequestContext ctx = mockRequestContext("POST", null);
            when(ctx.getProperty(ApiKeyAuthFilter.PRINCIPAL_PROPERTY))
                    .thenReturn(new ApiPrincipal("ops", SecurityRole.ADMIN));

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
        }

        @Test
        @DisplayName("class-level annotation applies when the method has none")
        void classLevelAnnotation() throws Exception {
            RoleAuthorizationFilter filter = new RoleAuthorizationFilter(config,
                    resourceInfo(ReaderResource.class, "list"));
            ContainerRequestContext ctx = mockRequestContext("GET", null);
            when(ctx.getProperty(ApiKeyAuthFilter.PRINCIPAL_PROPERTY))
                    .thenReturn(new ApiPrincipal("dashboard", SecurityRole.READER));

            filter.filter(ctx);

            verify(ctx, never()).abortWith(any());
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        private ResourceInfo resourceInfo(Class<?> type, String method) throws NoSuchMethodException {
            ResourceInfo resourceInfo = mock(ResourceInfo.class);
            when(resourceInfo.getResourceMethod()).thenReturn(type.getMethod(method));
            when(resourceInfo.getResourceClass()).thenReturn((Class) type);
            return resourceInfo;
        }
    }

    // Helper classes for annotation resolution
    static class UnprotectedEndpoint {
        public void open() {}
    }

    static class ProtectedEndpoint {
        @RequiresRole(SecurityRole.ADMIN)
        public void adminOnly() {}

        @RequiresRole(SecurityRole.CONTRIBUTOR)
        public void contributorEndpoint() {}
    }

    @RequiresRole(SecurityRole.READER)
    static class ReaderResource {
        public void list() {}
    }

    private static ContainerRequestContext mockRequestContext(String method, String apiKey) {
        ContainerRequestContext ctx = mock(ContainerRequestContext.class);
        when(ctx.getMethod()).thenReturn(method);
        when(ctx.getHeaderString("X-API-Key")).thenReturn(apiKey);
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/v1/names");
        when(ctx.getUriInfo()).thenReturn(uriInfo);
        SecurityContext securityContext = mock(SecurityContext.class);
        when(ctx.getSecurityContext()).thenReturn(securityContext);
        return ctx;
    }
}
