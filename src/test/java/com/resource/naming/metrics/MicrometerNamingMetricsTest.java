package com.resource.naming.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerNamingMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerNamingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerNamingMetrics(registry);
    }

    @Test
    void claimCountersAreTaggedByResourceType() {
        metrics.incrementClaimSucceeded("storage_account");
        metrics.incrementClaimSucceeded("storage_account");
        metrics.incrementClaimConflict("key_vault");
        metrics.incrementClaimRetry("virtual_machine");

        assertEquals(2.0, registry.get("naming.claim.succeeded").tag("resourceType", "storage_account").counter().count());
        assertEquals(1.0, registry.get("naming.claim.conflict").tag("resourceType", "key_vault").counter().count());
        assertEquals(1.0, registry.get("naming.claim.retry").counter().count());
    }

    @Test
    void claimDurationIsTimed() {
        metrics.recordClaimDuration("storage_account", "claimed", Duration.ofMillis(15));
        metrics.recordClaimDuration(null, "invalid", Duration.ofMillis(1));

        assertEquals(1, registry.get("naming.claim.duration").tags("resourceType", "storage_account", "outcome", "claimed")
                .timer().count());
        assertEquals(1, registry.get("naming.claim.duration").tag("resourceType", "unknown").timer().count());
    }

    @Test
    void releaseAndAuditCounters() {
        metrics.incrementRelease("released");
        metrics.incrementRelease("conflict");
        metrics.incrementAuditAppendFailed("released");

        assertEquals(1.0, registry.get("naming.release").tag("outcome", "conflict").counter().count());
        assertEquals(1.0, registry.get("naming.audit.append.failed").tag("action", "released").counter().count());
    }

    @Test
    void slugCountersAccumulate() {
        metrics.recordSlugCacheHit();
        metrics.recordSlugCacheMiss();
        metrics.recordSlugCacheMiss();
        metrics.recordSlugSync(40, 2);

        assertEquals(1.0, registry.get("naming.slug.cache.hit").counter().count());
        assertEquals(2.0, registry.get("naming.slug.cache.miss").counter().count());
        assertEquals(40.0, registry.get("naming.slug.sync.updated").counter().count());
        assertEquals(2.0, registry.get("naming.slug.sync.rejected").counter().count());
    }
}
