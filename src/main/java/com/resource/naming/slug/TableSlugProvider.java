package com.resource.naming.slug;

import com.resource.naming.core.model.SlugMapping;

import java.util.Optional;

/**
 * Slug provider backed by the synced slug table.
 */
public class TableSlugProvider implements SlugProvider {

    public static final String NAME = "table";

    private final SlugRepository repository;

    public TableSlugProvider(SlugRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SlugMapping> find(String candidate) {
        return repository.findByTypeOrName(candidate);
    }
}
