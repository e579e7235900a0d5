package com.resource.naming.slug;

import com.resource.naming.core.model.SlugMapping;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory slug table. Each upsert builds a new immutable snapshot and swaps it in,
 * so readers see either the old or the new table, never a mix.
 */
public class InMemorySlugRepository implements SlugRepository {

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    @Override
    public Optional<SlugMapping> findByTypeOrName(String candidate) {
        Snapshot current = snapshot.get();
        SlugMapping byType = current.byType().get(candidate);
        if (byType != null) {
            return Optional.of(byType);
        }
        return Optional.ofNullable(current.byFullName().get(candidate));
    }

    @Override
    public int upsertAll(Collection<SlugMapping> mappings) {
        snapshot.updateAndGet(current -> {
            Map<String, SlugMapping> byType = new HashMap<>(current.byType());
            for (SlugMapping mapping : mappings) {
                byType.put(mapping.resourceType(), mapping);
            }
            return Snapshot.of(byType);
        });
        return mappings.size();
    }

    @Override
    public List<SlugMapping> findAll() {
        return snapshot.get().byType().values().stream()
                .sorted(Comparator.comparing(SlugMapping::resourceType))
                .toList();
    }

    @Override
    public int count() {
        return snapshot.get().byType().size();
    }

    private record Snapshot(Map<String, SlugMapping> byType, Map<String, SlugMapping> byFullName) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        static Snapshot of(Map<String, SlugMapping> byType) {
            Map<String, SlugMapping> byFullName = new HashMap<>();
            for (SlugMapping mapping : byType.values()) {
                byFullName.putIfAbsent(mapping.fullName().toLowerCase(Locale.ROOT), mapping);
            }
            return new Snapshot(Map.copyOf(byType), Map.copyOf(byFullName));
        }
    }
}
