package com.resource.naming.slug;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resource.naming.core.model.SlugMapping;
import com.resource.naming.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback slugs bundled with the service, read from {@code slugs/default-slugs.json}
 * (an object of resource type to slug).
 */
public class StaticSlugProvider implements SlugProvider {
    private static final Logger log = LoggerFactory.getLogger(StaticSlugProvider.class);

    public static final String NAME = "static";
    public static final String DEFAULT_RESOURCE = "slugs/default-slugs.json";

    private final Map<String, SlugMapping> byType;
    private final Map<String, SlugMapping> byFullName;

    public StaticSlugProvider() {
        this(loadResource(DEFAULT_RESOURCE));
    }

    public StaticSlugProvider(Map<String, String> slugsByType) {
        Map<String, SlugMapping> types = new HashMap<>();
        Map<String, SlugMapping> names = new HashMap<>();
        slugsByType.forEach((type, slug) -> {
            SlugMapping mapping = SlugMapping.of(type, slug, NAME);
            types.put(mapping.resourceType(), mapping);
            names.put(mapping.fullName().toLowerCase(Locale.ROOT), mapping);
        });
        this.byType = Map.copyOf(types);
        this.byFullName = Map.copyOf(names);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SlugMapping> find(String candidate) {
        SlugMapping mapping = byType.get(candidate);
        return mapping != null ? Optional.of(mapping) : Optional.ofNullable(byFullName.get(candidate));
    }

    public int size() {
        return byType.size();
    }

    private static Map<String, String> loadResource(String resource) {
        ClassLoader loader = StaticSlugProvider.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Static slug resource not found: " + resource);
            }
            Map<String, String> slugs = new ObjectMapper().readValue(in, new TypeReference<Map<String, String>>() {});
            log.info("slug.static.loaded resource={} count={}", resource, slugs.size());
            return slugs;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read static slug resource " + resource, e);
        }
    }
}
