package com.resource.naming.api;

import com.resource.naming.audit.AuditRepository;
import com.resource.naming.audit.GraphAuditRepository;
import com.resource.naming.builder.NameBuilder;
import com.resource.naming.cache.CacheConfig;
import com.resource.naming.cache.CaffeineSlugCache;
import com.resource.naming.cache.SlugCache;
import com.resource.naming.graph.FalkorDBConnection;
import com.resource.naming.graph.GraphConnection;
import com.resource.naming.health.FalkorDBHealthCheck;
import com.resource.naming.health.HealthCheck;
import com.resource.naming.health.HealthCheckRegistry;
import com.resource.naming.health.HealthStatus;
import com.resource.naming.health.LedgerHealthCheck;
import com.resource.naming.health.RuleStoreHealthCheck;
import com.resource.naming.health.SlugCacheHealthCheck;
import com.resource.naming.ledger.ClaimLedger;
import com.resource.naming.ledger.GraphClaimLedger;
import com.resource.naming.ledger.InMemoryClaimLedger;
import com.resource.naming.metrics.NamingMetrics;
import com.resource.naming.metrics.NoOpNamingMetrics;
import com.resource.naming.rules.ClasspathRuleSource;
import com.resource.naming.rules.RuleLayer;
import com.resource.naming.rules.RuleSource;
import com.resource.naming.rules.RuleStore;
import com.resource.naming.sanitize.MetadataSanitizer;
import com.resource.naming.settings.UserSettingsService;
import com.resource.naming.slug.GraphSlugRepository;
import com.resource.naming.slug.InMemorySlugRepository;
import com.resource.naming.slug.SlugFeedParser;
import com.resource.naming.slug.SlugProvider;
import com.resource.naming.slug.SlugProviderRegistry;
import com.resource.naming.slug.SlugRepository;
import com.resource.naming.slug.SlugResolver;
import com.resource.naming.slug.SlugSyncService;
import com.resource.naming.tracing.NoOpTracingService;
import com.resource.naming.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Main entry point: wires the rule store, slug resolver, name builder, sanitizer and claim
 * ledger behind a {@link NameClaimService}.
 *
 * <p>With a graph connection the ledger, audit log and slug table live in FalkorDB;
 * without one everything is kept in memory.</p>
 *
 * <pre>
 * try (NamingEngine engine = NamingEngine.builder()
 *         .falkorDB("localhost", 6379, "naming")
 *         .build()) {
 *     ClaimResult result = engine.service().claim(
 *             ClaimRequest.builder().resourceType("storage_account").region("wus2").environment("prod").build(),
 *             AuthContext.of("alice", SecurityRole.CONTRIBUTOR));
 * }
 * </pre>
 */
public class NamingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NamingEngine.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final RuleStore ruleStore;
    private final SlugRepository slugRepository;
    private final SlugResolver slugResolver;
    private final ClaimLedger ledger;
    private final UserSettingsService settings;
    private final HealthCheckRegistry healthCheckRegistry;
    private final NameClaimService service;

    private NamingEngine(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;

        NamingMetrics metrics = builder.metrics != null ? builder.metrics : new NoOpNamingMetrics();
        TracingService tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();

        // Rules
        if (builder.ruleLayers != null) {
            this.ruleStore = new RuleStore();
            ruleStore.loadRules(builder.ruleLayers);
        } else {
            this.ruleStore = new RuleStore(builder.ruleSource != null ? builder.ruleSource : new ClasspathRuleSource());
        }

        // Storage
        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }
        if (builder.slugRepository != null) {
            this.slugRepository = builder.slugRepository;
        } else {
            this.slugRepository = connection != null ? new GraphSlugRepository(connection) : new InMemorySlugRepository();
        }
        if (builder.ledger != null) {
            this.ledger = builder.ledger;
        } else if (connection != null) {
            AuditRepository audit = builder.auditRepository != null
                    ? builder.auditRepository : new GraphAuditRepository(connection);
            this.ledger = new GraphClaimLedger(connection, audit);
        } else {
            this.ledger = builder.auditRepository != null
                    ? new InMemoryClaimLedger(builder.auditRepository) : new InMemoryClaimLedger();
        }

        // Slugs
        SlugProviderRegistry registry = new SlugProviderRegistry(slugRepository);
        builder.customProviders.forEach(registry::register);
        List<SlugProvider> chain = registry.createChain(builder.slugProviders);
        SlugCache cache = CaffeineSlugCache.create(builder.cacheConfig);
        this.slugResolver = new SlugResolver(chain, cache, metrics);
        SlugSyncService syncService = new SlugSyncService(new SlugFeedParser(), slugRepository, slugResolver, metrics);

        // Orchestration
        MetadataSanitizer sanitizer = new MetadataSanitizer();
        this.settings = builder.settings != null ? builder.settings : new UserSettingsService();
        NameBuilder nameBuilder = new NameBuilder(builder.options.getOrgPrefix());
        this.service = new NameClaimService(ruleStore, slugResolver, nameBuilder, sanitizer, ledger,
                syncService, settings, builder.options, metrics, tracing);

        // Health
        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new RuleStoreHealthCheck(ruleStore));
        healthCheckRegistry.register(new LedgerHealthCheck(ledger));
        healthCheckRegistry.register(new SlugCacheHealthCheck(slugResolver));
        if (connection != null) {
            healthCheckRegistry.register(new FalkorDBHealthCheck(connection));
        }
        builder.healthChecks.forEach(healthCheckRegistry::register);

        log.info("NamingEngine initialized: rules={}, slugProviders={}, ledger={}",
                ruleStore.sourceDescription(), slugResolver.providerNames(), ledger.getClass().getSimpleName());
    }

    public NameClaimService service() {
        return service;
    }

    public RuleStore ruleStore() {
        return ruleStore;
    }

    public SlugResolver slugResolver() {
        return slugResolver;
    }

    public SlugRepository slugRepository() {
        return slugRepository;
    }

    public ClaimLedger ledger() {
        return ledger;
    }

    public UserSettingsService settings() {
        return settings;
    }

    /**
     * Aggregate status of rules, ledger and, when configured, FalkorDB.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
        log.info("NamingEngine closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection;
        private boolean createIndexes = true;
        private RuleSource ruleSource;
        private List<RuleLayer> ruleLayers;
        private List<String> slugProviders = SlugProviderRegistry.DEFAULT_CHAIN;
        private final Map<String, Supplier<SlugProvider>> customProviders = new LinkedHashMap<>();
        private SlugRepository slugRepository;
        private ClaimLedger ledger;
        private AuditRepository auditRepository;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private NamingOptions options = NamingOptions.defaults();
        private NamingMetrics metrics;
        private TracingService tracing;
        private UserSettingsService settings;
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        /**
         * Uses an existing connection; the caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection that the engine closes on {@link #close()}.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder ruleSource(RuleSource ruleSource) {
            this.ruleSource = ruleSource;
            return this;
        }

        /**
         * Loads these layers instead of reading a rule source.
         */
        public Builder ruleLayers(List<RuleLayer> ruleLayers) {
            this.ruleLayers = List.copyOf(ruleLayers);
            return this;
        }

        /**
         * Provider names in resolution order, from the registry allow-list.
         */
        public Builder slugProviders(List<String> slugProviders) {
            this.slugProviders = List.copyOf(slugProviders);
            return this;
        }

        public Builder registerSlugProvider(String name, Supplier<SlugProvider> factory) {
            this.customProviders.put(name, factory);
            return this;
        }

        public Builder slugRepository(SlugRepository slugRepository) {
            this.slugRepository = slugRepository;
            return this;
        }

        public Builder ledger(ClaimLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder options(NamingOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(NamingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder settings(UserSettingsService settings) {
            this.settings = settings;
            return this;
        }

        public Builder healthCheck(HealthCheck check) {
            this.healthChecks.add(check);
            return this;
        }

        public NamingEngine build() {
            return new NamingEngine(this);
        }
    }
}
