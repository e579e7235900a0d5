package com.resource.naming.slug;

import com.resource.naming.core.model.SlugMapping;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for synced slug mappings. Rows are overwritten on sync and never deleted.
 */
public interface SlugRepository {

    /**
     * Exact match on resource type or full name. Returns at most one mapping.
     */
    Optional<SlugMapping> findByTypeOrName(String candidate);

    /**
     * Inserts or overwrites mappings keyed by resource type.
     *
     * @return the number of mappings written
     */
    int upsertAll(Collection<SlugMapping> mappings);

    /**
     * All mappings ordered by resource type.
     */
    List<SlugMapping> findAll();

    int count();
}
