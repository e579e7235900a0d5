package com.resource.naming.ledger;

import com.resource.naming.audit.AuditEntry;
import com.resource.naming.audit.AuditQuery;
import com.resource.naming.audit.AuditRepository;
import com.resource.naming.audit.InMemoryAuditRepository;
import com.resource.naming.core.model.ClaimKey;
import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.error.ConflictException;
import com.resource.naming.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of ClaimLedger.
 * Atomic create via {@link ConcurrentHashMap#putIfAbsent}, conditional replace via
 * {@link ConcurrentHashMap#compute}. Versions come from a single sequence.
 */
public class InMemoryClaimLedger implements ClaimLedger {
    private static final Logger log = LoggerFactory.getLogger(InMemoryClaimLedger.class);

    private final Map<ClaimKey, VersionedClaim> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AuditRepository auditRepository;

    public InMemoryClaimLedger() {
        this(new InMemoryAuditRepository());
    }

    public InMemoryClaimLedger(AuditRepository auditRepository) {
        this.auditRepository = auditRepository;
    }

    @Override
    public VersionToken createIfAbsent(ClaimKey key, ClaimedName record) {
        VersionedClaim candidate = new VersionedClaim(record, VersionToken.of(sequence.incrementAndGet()));
        VersionedClaim existing = rows.putIfAbsent(key, candidate);
        if (existing != null) {
            throw new ConflictException("Name '" + key.name() + "' already exists in " + key.partition());
        }
        log.debug("ledger.created key={} version={}", key, candidate.version());
        return candidate.version();
    }

    @Override
    public VersionToken replaceIfUnchanged(ClaimKey key, ClaimedName record, VersionToken expected) {
        VersionedClaim[] outcome = new VersionedClaim[1];
        rows.compute(key, (k, current) -> {
            if (current == null) {
                throw new NotFoundException("Name '" + k.name() + "' not found in " + k.partition());
            }
            if (!current.version().equals(expected)) {
                throw new ConflictException("Name '" + k.name() + "' was modified concurrently");
            }
            outcome[0] = new VersionedClaim(record, VersionToken.of(sequence.incrementAndGet()));
            return outcome[0];
        });
        log.debug("ledger.replaced key={} version={}", key, outcome[0].version());
        return outcome[0].version();
    }

    @Override
    public VersionedClaim get(ClaimKey key) {
        VersionedClaim row = rows.get(key);
        if (row == null) {
            throw new NotFoundException("Name '" + key.name() + "' not found in " + key.partition());
        }
        return row;
    }

    @Override
    public void appendAudit(AuditEntry entry) {
        auditRepository.save(entry);
    }

    @Override
    public List<AuditEntry> auditTrail(ClaimKey key) {
        return auditRepository.findByName(key.region(), key.environment(), key.name());
    }

    @Override
    public List<AuditEntry> queryAudit(AuditQuery query) {
        return auditRepository.query(query);
    }

    public int size() {
        return rows.size();
    }
}
