package com.resource.naming.cdi;

import com.resource.naming.api.NameClaimService;
import com.resource.naming.api.NamingEngine;
import com.resource.naming.api.NamingOptions;
import com.resource.naming.cache.CacheConfig;
import com.resource.naming.metrics.MicrometerNamingMetrics;
import com.resource.naming.metrics.NamingMetrics;
import com.resource.naming.metrics.NoOpNamingMetrics;
import com.resource.naming.rest.security.ApiKeyAuthFilter;
import com.resource.naming.rest.security.RoleAuthorizationFilter;
import com.resource.naming.rest.security.SecurityConfig;
import com.resource.naming.rules.ClasspathRuleSource;
import com.resource.naming.rules.DirectoryRuleSource;
import com.resource.naming.rules.RuleSource;
import com.resource.naming.security.SecurityRole;
import com.resource.naming.tracing.NoOpTracingService;
import com.resource.naming.tracing.OpenTelemetryTracingService;
import com.resource.naming.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the naming engine from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus), it reads
 * configuration from {@code application.properties} and produces the {@link NamingEngine},
 * the {@link NameClaimService} and the security filters.</p>
 *
 * <h2>Minimal configuration</h2>
 * <p>Without FalkorDB settings the ledger, audit log and slug table are kept in memory:</p>
 * <pre>
 * naming.falkordb.enabled=true
 * naming.falkordb.host=localhost
 * naming.falkordb.port=6379
 * naming.falkordb.graph-name=naming
 * naming.security.contributor-keys=alice:nm-ak-alice-xxxx
 * </pre>
 *
 * <p>A {@link MeterRegistry} or {@link OpenTelemetry} bean, when the container has one,
 * is picked up for metrics and tracing.</p>
 */
@ApplicationScoped
public class NamingProducer {

    private static final Logger log = LoggerFactory.getLogger(NamingProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "naming.falkordb.enabled", defaultValue = "false")
    boolean falkordbEnabled;

    @Inject
    @ConfigProperty(name = "naming.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "naming.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "naming.falkordb.graph-name", defaultValue = "naming")
    String falkordbGraphName;

    // ── Rules and slugs ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "naming.rules.path")
    Optional<String> rulesPath;

    @Inject
    @ConfigProperty(name = "naming.slug.providers", defaultValue = "table,static")
    List<String> slugProviders;

    // ── Claims ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "naming.claim.max-attempts", defaultValue = "5")
    int maxClaimAttempts;

    @Inject
    @ConfigProperty(name = "naming.claim.org-prefix", defaultValue = "org")
    String orgPrefix;

    @Inject
    @ConfigProperty(name = "naming.claim.index-width", defaultValue = "2")
    int indexWidth;

    @Inject
    @ConfigProperty(name = "naming.claim.default-release-reason", defaultValue = "not specified")
    String defaultReleaseReason;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "naming.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "naming.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "naming.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── Security ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "naming.security.enabled", defaultValue = "true")
    boolean securityEnabled;

    @Inject
    @ConfigProperty(name = "naming.security.api-key-header", defaultValue = "X-API-Key")
    String apiKeyHeader;

    @Inject
    @ConfigProperty(name = "naming.security.admin-keys")
    Optional<List<String>> adminKeys;

    @Inject
    @ConfigProperty(name = "naming.security.contributor-keys")
    Optional<List<String>> contributorKeys;

    @Inject
    @ConfigProperty(name = "naming.security.reader-keys")
    Optional<List<String>> readerKeys;

    // ── Observability ─────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<OpenTelemetry> openTelemetry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public NamingEngine namingEngine() {
        NamingOptions options = NamingOptions.builder()
                .maxClaimAttempts(maxClaimAttempts)
                .orgPrefix(orgPrefix)
                .indexWidth(indexWidth)
                .defaultReleaseReason(defaultReleaseReason)
                .build();

        NamingEngine.Builder builder = NamingEngine.builder()
                .ruleSource(createRuleSource())
                .slugProviders(slugProviders)
                .cacheConfig(cacheEnabled ? CacheConfig.of(cacheMaxSize, cacheTtlSeconds) : CacheConfig.disabled())
                .options(options)
                .metrics(createMetrics())
                .tracing(createTracing());

        if (falkordbEnabled) {
            log.info("Producing NamingEngine: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            builder.falkorDB(falkordbHost, falkordbPort, falkordbGraphName);
        } else {
            log.info("Producing NamingEngine: in-memory storage");
        }
        return builder.build();
    }

    public void closeEngine(@Disposes NamingEngine engine) {
        log.info("Closing NamingEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public NameClaimService nameClaimService(NamingEngine engine) {
        return engine.service();
    }

    @Produces
    @ApplicationScoped
    public SecurityConfig securityConfig() {
        SecurityConfig.Builder builder = SecurityConfig.builder()
                .enabled(securityEnabled)
                .apiKeyHeader(apiKeyHeader);

        adminKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.ADMIN));
        contributorKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.CONTRIBUTOR));
        readerKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.READER));

        SecurityConfig config = builder.build();
        log.info("Security config: enabled={} keyCount={}", config.isEnabled(), config.keyCount());
        if (!config.isEnabled()) {
            log.warn("Security disabled: every request runs as '{}' with ADMIN role", SecurityConfig.ANONYMOUS_ACTOR);
        }
        return config;
    }

    @Produces
    @ApplicationScoped
    public ApiKeyAuthFilter apiKeyAuthFilter(SecurityConfig config) {
        return new ApiKeyAuthFilter(config);
    }

    @Produces
    @ApplicationScoped
    public RoleAuthorizationFilter roleAuthorizationFilter(SecurityConfig config) {
        return new RoleAuthorizationFilter(config);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private RuleSource createRuleSource() {
        if (rulesPath.isPresent() && !rulesPath.get().isBlank()) {
            log.info("Loading naming rules from directory {}", rulesPath.get());
            return new DirectoryRuleSource(Path.of(rulesPath.get()));
        }
        return new ClasspathRuleSource();
    }

    private NamingMetrics createMetrics() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerNamingMetrics(meterRegistry.get());
        }
        log.info("No MeterRegistry available, naming metrics disabled");
        return new NoOpNamingMetrics();
    }

    private TracingService createTracing() {
        if (openTelemetry != null && openTelemetry.isResolvable()) {
            return new OpenTelemetryTracingService(openTelemetry.get());
        }
        return new NoOpTracingService();
    }
}
