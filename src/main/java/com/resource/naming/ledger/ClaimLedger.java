package com.resource.naming.ledger;

import com.resource.naming.audit.AuditEntry;
import com.resource.naming.audit.AuditQuery;
import com.resource.naming.core.model.ClaimKey;
import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.error.ConflictException;
import com.resource.naming.error.NotFoundException;

import java.util.List;

/**
 * Keyed store of claimed names plus their audit log.
 * Same-key writes are serialized here and nowhere else: exactly one concurrent
 * {@link #createIfAbsent} wins per key, and exactly one {@link #replaceIfUnchanged}
 * wins per version.
 */
public interface ClaimLedger {

    /**
     * Creates the row if no row exists at the key.
     *
     * @return the version of the new row
     * @throws ConflictException if a row already exists, in use or not
     */
    VersionToken createIfAbsent(ClaimKey key, ClaimedName record);

    /**
     * Replaces the row only if its version still equals {@code expected}.
     *
     * @return the new version
     * @throws ConflictException if the stored version differs
     * @throws NotFoundException if no row exists
     */
    VersionToken replaceIfUnchanged(ClaimKey key, ClaimedName record, VersionToken expected);

    /**
     * @throws NotFoundException if no row exists
     */
    VersionedClaim get(ClaimKey key);

    /**
     * Append-only write. Failures propagate to the caller.
     */
    void appendAudit(AuditEntry entry);

    /**
     * Audit entries for one name, oldest first.
     */
    List<AuditEntry> auditTrail(ClaimKey key);

    /**
     * Audit entries matching a validated filter set, newest first.
     */
    List<AuditEntry> queryAudit(AuditQuery query);

    /**
     * Whether the backing store is reachable.
     */
    default boolean isAvailable() {
        return true;
    }
}
