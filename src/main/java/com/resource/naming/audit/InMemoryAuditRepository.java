package com.resource.naming.audit;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of AuditRepository.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findByName(String region, String environment, String name) {
        return entries.stream()
                .filter(e -> name.equals(e.name()))
                .filter(e -> region.equals(e.region()) && environment.equals(e.environment()))
                .sorted(Comparator.comparing(AuditEntry::timestamp))
                .toList();
    }

    @Override
    public List<AuditEntry> query(AuditQuery query) {
        return entries.stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(AuditEntry::timestamp).reversed())
                .toList();
    }

    @Override
    public int count() {
        return entries.size();
    }
}
