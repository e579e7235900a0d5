package com.resource.naming.rest.dto;

import com.resource.naming.slug.SlugSyncService;

/**
 * Response DTO for a slug table sync.
 */
public record SlugSyncResponse(int updatedCount, int rejectedCount, String syncedAt) {

    public static SlugSyncResponse from(SlugSyncService.SyncSummary summary) {
        return new SlugSyncResponse(summary.updatedCount(), summary.rejectedCount(),
                summary.syncedAt().toString());
    }
}
