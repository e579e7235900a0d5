package com.resource.naming.metrics;

import java.time.Duration;

/**
 * No-op metrics. Used when no meter registry is configured.
 */
public class NoOpNamingMetrics implements NamingMetrics {

    @Override
    public void recordClaimDuration(String resourceType, String outcome, Duration duration) {
    }

    @Override
    public void incrementClaimSucceeded(String resourceType) {
    }

    @Override
    public void incrementClaimConflict(String resourceType) {
    }

    @Override
    public void incrementClaimRetry(String resourceType) {
    }

    @Override
    public void incrementRelease(String outcome) {
    }

    @Override
    public void incrementAuditAppendFailed(String action) {
    }

    @Override
    public void recordSlugCacheHit() {
    }

    @Override
    public void recordSlugCacheMiss() {
    }

    @Override
    public void recordSlugSync(int updated, int rejected) {
    }
}
