package com.resource.naming.slug;

import com.resource.naming.cache.CacheConfig;
import com.resource.naming.cache.CaffeineSlugCache;
import com.resource.naming.core.model.SlugMapping;
import com.resource.naming.error.NotFoundException;
import com.resource.naming.error.ValidationException;
import com.resource.naming.metrics.NoOpNamingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SlugResolverTest {

    private InMemorySlugRepository repository;
    private SlugResolver resolver;

    @BeforeEach
    void setUp() {
        repository = new InMemorySlugRepository();
        repository.upsertAll(List.of(
                SlugMapping.of("storage_account", "st", "upstream"),
                new SlugMapping("postgresql_flexible_server", "psqlf", "postgres flexible", null, "upstream")));
        resolver = new SlugResolver(List.of(
                new TableSlugProvider(repository),
                new StaticSlugProvider(Map.of("storage_account", "sa", "key_vault", "kv"))));
    }

    @Nested
    @DisplayName("resolution order")
    class Order {

        @Test
        void tableWinsOverStatic() {
            SlugMapping mapping = resolver.resolveMapping("storage_account");
            assertEquals("st", mapping.slug());
            assertEquals("upstream", mapping.source());
        }

        @Test
        void fallsBackToStatic() {
            SlugMapping mapping = resolver.resolveMapping("key_vault");
            assertEquals("kv", mapping.slug());
            assertEquals(StaticSlugProvider.NAME, mapping.source());
        }

        @Test
        void providerNamesFollowChain() {
            assertEquals(List.of("table", "static"), resolver.providerNames());
        }
    }

    @Nested
    @DisplayName("input forms")
    class InputForms {

        @Test
        void spaceAndUnderscoreAreEquivalent() {
            assertEquals("st", resolver.resolve("storage account"));
            assertEquals("st", resolver.resolve("Storage_Account"));
            assertEquals("st", resolver.resolve("  STORAGE   ACCOUNT "));
        }

        @Test
        void fullNameMatches() {
            assertEquals("psqlf", resolver.resolve("Postgres Flexible"));
        }

        @Test
        void injectionStringIsNotFound() {
            assertThrows(NotFoundException.class,
                    () -> resolver.resolve("storage_account' OR '1'='1"));
        }

        @Test
        void blankInputIsInvalid() {
            assertThrows(ValidationException.class, () -> resolver.resolve("  "));
            assertThrows(ValidationException.class, () -> resolver.resolve(null));
        }

        @Test
        void overlongInputIsInvalid() {
            assertThrows(ValidationException.class,
                    () -> resolver.resolve("a".repeat(SlugResolver.MAX_INPUT_LENGTH + 1)));
        }

        @Test
        void candidatesAreOrdered() {
            assertEquals(List.of("app service", "app_service"),
                    List.copyOf(SlugResolver.candidates("App Service")));
        }
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        void cachedResolutionSkipsProviders() {
            AtomicInteger lookups = new AtomicInteger();
            SlugProvider counting = new SlugProvider() {
                @Override
                public String name() {
                    return "counting";
                }

                @Override
                public Optional<SlugMapping> find(String candidate) {
                    lookups.incrementAndGet();
                    return Optional.of(SlugMapping.of(candidate, "x", "counting"));
                }
            };
            SlugResolver cached = new SlugResolver(List.of(counting),
                    new CaffeineSlugCache(CacheConfig.defaults()), new NoOpNamingMetrics());

            cached.resolve("thing");
            cached.resolve("thing");
            assertEquals(1, lookups.get());

            cached.invalidateCache();
            cached.resolve("thing");
            assertEquals(2, lookups.get());
        }

        @Test
        void invalidationDuringLookupIsNotOverwritten() {
            SlugResolver[] holder = new SlugResolver[1];
            AtomicInteger lookups = new AtomicInteger();
            SlugProvider syncingMidLookup = new SlugProvider() {
                @Override
                public String name() {
                    return "syncing";
                }

                @Override
                public Optional<SlugMapping> find(String candidate) {
                    lookups.incrementAndGet();
                    holder[0].invalidateCache();
                    return Optional.of(SlugMapping.of(candidate, "old", "syncing"));
                }
            };
            holder[0] = new SlugResolver(List.of(syncingMidLookup),
                    new CaffeineSlugCache(CacheConfig.defaults()), new NoOpNamingMetrics());

            assertEquals("old", holder[0].resolve("thing"));

            assertEquals(0, holder[0].cacheStats().size());
            holder[0].resolve("thing");
            assertEquals(2, lookups.get());
        }

        @Test
        void statsCountHitsAndMisses() {
            SlugResolver cached = new SlugResolver(List.of(new StaticSlugProvider(Map.of("key_vault", "kv"))),
                    new CaffeineSlugCache(CacheConfig.defaults()), new NoOpNamingMetrics());

            cached.resolve("key_vault");
            cached.resolve("key_vault");

            assertTrue(cached.cacheStats().enabled());
            assertEquals(1, cached.cacheStats().hitCount());
            assertEquals(1, cached.cacheStats().size());
        }

        @Test
        void resolverWithoutCacheReportsDisabled() {
            assertFalse(resolver.cacheStats().enabled());
        }
    }

    @Test
    void emptyChainIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SlugResolver(List.of()));
    }
}
