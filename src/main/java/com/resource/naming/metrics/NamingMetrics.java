package com.resource.naming.metrics;

import java.time.Duration;

/**
 * Interface for recording naming metrics.
 * The default {@link NoOpNamingMetrics} does nothing, so the engine works
 * without a meter registry.
 */
public interface NamingMetrics {

    void recordClaimDuration(String resourceType, String outcome, Duration duration);

    void incrementClaimSucceeded(String resourceType);

    void incrementClaimConflict(String resourceType);

    /**
     * One alternate candidate tried after a conflict.
     */
    void incrementClaimRetry(String resourceType);

    void incrementRelease(String outcome);

    /**
     * An audit append failed after the claim or release itself was committed.
     */
    void incrementAuditAppendFailed(String action);

    void recordSlugCacheHit();

    void recordSlugCacheMiss();

    void recordSlugSync(int updated, int rejected);
}
