package com.resource.naming.slug;

import com.resource.naming.core.model.SlugMapping;

import java.util.Optional;

/**
 * One link in the slug resolution chain.
 */
public interface SlugProvider {

    /**
     * Registry name of this provider, e.g. {@code table}.
     */
    String name();

    /**
     * Exact lookup of one normalized candidate against resource type or full name.
     */
    Optional<SlugMapping> find(String candidate);
}
