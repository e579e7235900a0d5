package com.resource.naming.rest.dto;

import com.resource.naming.audit.AuditEntry;

import java.util.Map;

/**
 * Response DTO for an audit record.
 */
public record AuditEntryResponse(
        String id,
        String action,
        String name,
        String actor,
        String region,
        String environment,
        String note,
        Map<String, String> metadata,
        String timestamp
) {
    public static AuditEntryResponse from(AuditEntry entry) {
        return new AuditEntryResponse(
                entry.id(),
                entry.action().wireName(),
                entry.name(),
                entry.actor(),
                entry.region(),
                entry.environment(),
                entry.note(),
                entry.metadata(),
                entry.timestamp().toString()
        );
    }
}
