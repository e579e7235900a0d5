package com.resource.naming.cdi;

import com.resource.naming.api.ClaimRequest;
import com.resource.naming.api.ClaimResult;
import com.resource.naming.api.NamingEngine;
import com.resource.naming.ledger.InMemoryClaimLedger;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the producer outside a container, with the fields set as config injection would.
 */
@DisplayName("NamingProducer")
class NamingProducerTest {

    private NamingProducer producer;

    @BeforeEach
    void setUp() {
        producer = new NamingProducer();
        producer.falkordbEnabled = false;
        producer.rulesPath = Optional.empty();
        producer.slugProviders = List.of("table", "static");
        producer.maxClaimAttempts = 5;
        producer.orgPrefix = "acme";
        producer.indexWidth = 3;
        producer.defaultReleaseReason = "not specified";
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.securityEnabled = true;
        producer.apiKeyHeader = "X-API-Key";
        producer.adminKeys = Optional.of(List.of("ops:admin-key"));
        producer.contributorKeys = Optional.of(List.of("alice:alice-key", "bob:bob-key"));
        producer.readerKeys = Optional.empty();
    }

    @Test
    @DisplayName("produces an in-memory engine honouring the claim options")
    void producesInMemoryEngine() {
        NamingEngine engine = producer.namingEngine();
        try {
            assertInstanceOf(InMemoryClaimLedger.class, engine.ledger());
            assertTrue(engine.ruleStore().isReady());

            ClaimResult result = producer.nameClaimService(engine).claim(ClaimRequest.builder()
                    .resourceType("storage_account")
                    .region("wus2")
                    .environment("prod")
                    .build(), AuthContext.of("alice", SecurityRole.CONTRIBUTOR));

            assertTrue(result.isClaimed(), result.message());
            assertEquals("acme-st-wus2-prod", result.name());
        } finally {
            producer.closeEngine(engine);
        }
    }

    @Test
    void producesSecurityConfigFromKeyLists() {
        SecurityConfig config = producer.securityConfig();

        assertTrue(config.isEnabled());
        assertEquals(3, config.keyCount());
        assertEquals("alice", config.getPrincipalForKey("alice-key").actor());
        assertEquals(SecurityRole.ADMIN, config.getPrincipalForKey("admin-key").role());
        assertNotNull(producer.apiKeyAuthFilter(config));
        assertNotNull(producer.roleAuthorizationFilter(config));
    }

    @Test
    void malformedKeyEntryFailsFast() {
        producer.readerKeys = Optional.of(List.of("no-separator"));
        assertThrows(IllegalArgumentException.class, producer::securityConfig);
    }
}
