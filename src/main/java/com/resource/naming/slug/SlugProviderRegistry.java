package com.resource.naming.slug;

import com.resource.naming.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Allow-list of slug providers selectable by name from configuration.
 * Only registered factories can be instantiated; names never reach a class loader.
 */
public class SlugProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(SlugProviderRegistry.class);

    public static final List<String> DEFAULT_CHAIN = List.of(TableSlugProvider.NAME, StaticSlugProvider.NAME);

    private final Map<String, Supplier<SlugProvider>> factories = new TreeMap<>();

    /**
     * Registry with the built-in {@code table} and {@code static} providers.
     */
    public SlugProviderRegistry(SlugRepository repository) {
        register(TableSlugProvider.NAME, () -> new TableSlugProvider(repository));
        register(StaticSlugProvider.NAME, StaticSlugProvider::new);
    }

    public SlugProviderRegistry register(String name, Supplier<SlugProvider> factory) {
        factories.put(name.trim().toLowerCase(Locale.ROOT), factory);
        return this;
    }

    /**
     * Instantiates the named providers in order.
     *
     * @throws ConfigurationException for an empty chain or an unregistered name
     */
    public List<SlugProvider> createChain(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException("Slug provider chain must not be empty");
        }
        List<SlugProvider> chain = new ArrayList<>(names.size());
        for (String raw : names) {
            String name = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            Supplier<SlugProvider> factory = factories.get(name);
            if (factory == null) {
                throw new ConfigurationException(
                        "Unknown slug provider '" + raw + "'; allowed: " + factories.keySet());
            }
            chain.add(factory.get());
        }
        log.info("slug.chain.created providers={}", names);
        return chain;
    }

    public List<String> registeredNames() {
        return List.copyOf(factories.keySet());
    }
}
