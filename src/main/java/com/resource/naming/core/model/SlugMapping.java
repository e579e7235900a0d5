package com.resource.naming.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Resource type to short code association.
 *
 * @param resourceType canonical lowercase resource type, e.g. {@code storage_account}
 * @param slug         short code embedded in names, e.g. {@code st}
 * @param fullName     optional human readable name, e.g. {@code storage account}
 * @param updatedAt    when this mapping was last written
 * @param source       where the mapping came from ({@code upstream}, {@code static}, ...)
 */
public record SlugMapping(
        String resourceType,
        String slug,
        String fullName,
        Instant updatedAt,
        String source
) {
    public SlugMapping {
        Objects.requireNonNull(resourceType, "resourceType is required");
        Objects.requireNonNull(slug, "slug is required");
        resourceType = resourceType.trim().toLowerCase(Locale.ROOT);
        slug = slug.trim().toLowerCase(Locale.ROOT);
        if (fullName == null || fullName.isBlank()) {
            fullName = resourceType.replace('_', ' ');
        }
        updatedAt = updatedAt != null ? updatedAt : Instant.now();
        source = source != null ? source : "unknown";
    }

    public static SlugMapping of(String resourceType, String slug, String source) {
        return new SlugMapping(resourceType, slug, null, Instant.now(), source);
    }
}
