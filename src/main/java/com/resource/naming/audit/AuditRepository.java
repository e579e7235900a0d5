package com.resource.naming.audit;

import java.util.List;

/**
 * Append-only audit log storage.
 * Implementations provide different storage backends (in-memory, graph DB, etc.).
 */
public interface AuditRepository {

    /**
     * Appends an entry. Failures propagate to the caller.
     */
    AuditEntry save(AuditEntry entry);

    /**
     * Entries for one name in one region/environment, oldest first.
     */
    List<AuditEntry> findByName(String region, String environment, String name);

    /**
     * Entries matching the filters, newest first.
     */
    List<AuditEntry> query(AuditQuery query);

    int count();
}
