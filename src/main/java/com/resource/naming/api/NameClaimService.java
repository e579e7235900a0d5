package com.resource.naming.api;

import com.resource.naming.audit.AuditAction;
import com.resource.naming.audit.AuditEntry;
import com.resource.naming.audit.AuditQuery;
import com.resource.naming.builder.NameBuilder;
import com.resource.naming.core.model.ClaimKey;
import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.SlugMapping;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.error.AuthorizationException;
import com.resource.naming.error.ConflictException;
import com.resource.naming.error.NamingException;
import com.resource.naming.error.NotFoundException;
import com.resource.naming.error.ValidationException;
import com.resource.naming.ledger.ClaimLedger;
import com.resource.naming.logging.LogContext;
import com.resource.naming.metrics.NamingMetrics;
import com.resource.naming.rules.NamingRule;
import com.resource.naming.rules.RuleDescription;
import com.resource.naming.rules.RuleFields;
import com.resource.naming.rules.RuleStore;
import com.resource.naming.rules.Templates;
import com.resource.naming.sanitize.MetadataSanitizer;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import com.resource.naming.settings.UserSettingsService;
import com.resource.naming.slug.SlugResolver;
import com.resource.naming.slug.SlugSyncService;
import com.resource.naming.tracing.Span;
import com.resource.naming.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Claim and release orchestration plus the read operations exposed to the transport layer.
 *
 * <p>A claim runs Validating, Resolving, Building and Persisting. Uniqueness rests entirely on the
 * ledger's atomic create; nothing here locks. Expected failures (validation, conflict, not found,
 * authorization, upstream) come back as typed results; anything else propagates.</p>
 *
 * <p>Audit writes happen after the claim or release is committed. A failed audit write does not
 * undo the operation: the result carries {@link ResultWarning#AUDIT_WRITE_FAILED} and the failure
 * is logged and counted.</p>
 */
public class NameClaimService {
    private static final Logger log = LoggerFactory.getLogger(NameClaimService.class);

    private static final Pattern LOCATION = Pattern.compile("^[a-z0-9]{1,32}$");
    private static final Pattern CLAIMED_NAME = Pattern.compile("^[a-z0-9-]{1,255}$");

    private final RuleStore ruleStore;
    private final SlugResolver slugResolver;
    private final NameBuilder nameBuilder;
    private final MetadataSanitizer sanitizer;
    private final ClaimLedger ledger;
    private final SlugSyncService slugSyncService;
    private final UserSettingsService settings;
    private final NamingOptions options;
    private final NamingMetrics metrics;
    private final TracingService tracing;

    public NameClaimService(RuleStore ruleStore, SlugResolver slugResolver, NameBuilder nameBuilder,
                            MetadataSanitizer sanitizer, ClaimLedger ledger, SlugSyncService slugSyncService,
                            UserSettingsService settings, NamingOptions options,
                            NamingMetrics metrics, TracingService tracing) {
        this.ruleStore = ruleStore;
        this.slugResolver = slugResolver;
        this.nameBuilder = nameBuilder;
        this.sanitizer = sanitizer;
        this.ledger = ledger;
        this.slugSyncService = slugSyncService;
        this.settings = settings;
        this.options = options;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    // ========== Claim ==========

    /**
     * Builds a compliant name for the request and reserves it.
     * Requires {@link SecurityRole#CONTRIBUTOR}.
     */
    public ClaimResult claim(ClaimRequest request, AuthContext auth) {
        long startNanos = System.nanoTime();
        String metricType = metricType(request.resourceType());
        String correlationId = LogContext.generateCorrelationId();

        try (LogContext ctx = LogContext.forClaim(correlationId, request.resourceType(), actorOf(auth));
             Span span = tracing.startSpan(TracingService.CLAIM, spanAttributes(
                     "naming.resource_type", request.resourceType(),
                     "naming.region", request.region(),
                     "naming.environment", request.environment()))) {
            ClaimResult result;
            try {
                requireRole(auth, SecurityRole.CONTRIBUTOR, "claim names");
                result = doClaim(request, auth, metricType);
                metrics.incrementClaimSucceeded(metricType);
                span.setAttribute("naming.name", result.name());
                span.setStatus(Span.SpanStatus.OK);
            } catch (NamingException e) {
                result = ClaimResult.failure(ResultStatus.of(e.kind()), e.getMessage());
                if (e instanceof ConflictException) {
                    metrics.incrementClaimConflict(metricType);
                }
                span.setAttribute("naming.outcome", result.status().name());
                log.info("claim.rejected status={} message={}", result.status(), e.getMessage());
            } catch (RuntimeException e) {
                span.fail(e);
                metrics.recordClaimDuration(metricType, "error", Duration.ofNanos(System.nanoTime() - startNanos));
                log.error("claim.failed resourceType={}", request.resourceType(), e);
                throw e;
            }
            metrics.recordClaimDuration(metricType, result.status().name().toLowerCase(Locale.ROOT),
                    Duration.ofNanos(System.nanoTime() - startNanos));
            return result;
        }
    }

    private ClaimResult doClaim(ClaimRequest request, AuthContext auth, String metricType) {
        // Validating
        Map<String, String> payload = settings.applyDefaults(auth.actor(), request.sessionId(), payloadOf(request));
        String resourceType = RuleStore.normalizeType(required(payload, RuleFields.RESOURCE_TYPE));
        String region = location(payload.get(RuleFields.REGION), RuleFields.REGION);
        String environment = location(payload.get(RuleFields.ENVIRONMENT), RuleFields.ENVIRONMENT);
        payload.put(RuleFields.RESOURCE_TYPE, resourceType);
        payload.put(RuleFields.REGION, region);
        payload.put(RuleFields.ENVIRONMENT, environment);

        NamingRule rule = ruleStore.getRule(resourceType);
        rule.validatePayload(payload);

        // Resolving
        SlugMapping mapping = slugResolver.resolveMapping(resourceType);
        String slug = mapping.slug();

        // Building
        Map<String, String> values = new HashMap<>(payload);
        values.put(RuleFields.SLUG, slug);
        Map<String, String> metadata = sanitizer.sanitize(request.metadata());
        List<String> indexCandidates = indexCandidates(rule, payload);

        // Persisting
        String lastName = null;
        for (int attempt = 0; attempt < indexCandidates.size(); attempt++) {
            String index = indexCandidates.get(attempt);
            if (index != null) {
                values.put(RuleFields.INDEX, index);
            }
            String name = nameBuilder.build(rule, values);
            if (name.equals(lastName)) {
                continue;
            }
            if (attempt > 0) {
                metrics.incrementClaimRetry(metricType);
                log.debug("claim.retry attempt={} candidate={}", attempt + 1, name);
            }
            lastName = name;

            ClaimKey key = ClaimKey.of(region, environment, name);
            Map<String, String> segments = usedSegments(rule, values);
            ClaimedName record = ClaimedName.builder()
                    .name(key.name())
                    .region(region)
                    .environment(environment)
                    .resourceType(resourceType)
                    .slug(slug)
                    .claimedBy(auth.actor())
                    .claimedAt(Instant.now())
                    .segments(segments)
                    .metadata(metadata)
                    .build();

            Optional<VersionToken> version = tryClaim(key, record);
            if (version.isPresent()) {
                log.info("claim.succeeded name={} partition={} attempts={}", key.name(), key.partition(), attempt + 1);
                return claimed(rule, record, payload, version.get(), request.metadata());
            }
        }

        if (indexCandidates.size() > 1) {
            throw new ConflictException("All " + indexCandidates.size() + " candidate names for resource type '"
                    + resourceType + "' in " + region + "-" + environment + " are already in use");
        }
        throw new ConflictException("Name '" + lastName + "' is already in use.");
    }

    /**
     * Atomic create; over a released row, a conditional replace at the version just read.
     * Empty when the name is held by a live claim or a concurrent writer won.
     */
    private Optional<VersionToken> tryClaim(ClaimKey key, ClaimedName record) {
        try {
            return Optional.of(ledger.createIfAbsent(key, record));
        } catch (ConflictException e) {
            VersionedClaim existing;
            try {
                existing = ledger.get(key);
            } catch (NotFoundException gone) {
                return Optional.empty();
            }
            if (existing.claim().inUse()) {
                return Optional.empty();
            }
            try {
                VersionToken version = ledger.replaceIfUnchanged(key, record, existing.version());
                log.info("claim.reclaimed name={} partition={} previousVersion={}",
                        key.name(), key.partition(), existing.version());
                return Optional.of(version);
            } catch (ConflictException | NotFoundException raced) {
                return Optional.empty();
            }
        }
    }

    private ClaimResult claimed(NamingRule rule, ClaimedName record, Map<String, String> payload,
                                VersionToken version, Map<String, Object> rawMetadata) {
        Map<String, Object> auditRaw = new LinkedHashMap<>(rawMetadata);
        auditRaw.putAll(record.segments());
        auditRaw.put(RuleFields.RESOURCE_TYPE, record.resourceType());
        auditRaw.put(RuleFields.REGION, record.region());
        auditRaw.put(RuleFields.ENVIRONMENT, record.environment());
        auditRaw.put(RuleFields.SLUG, record.slug());

        AuditEntry entry = AuditEntry.builder()
                .action(AuditAction.CLAIMED)
                .name(record.name())
                .actor(record.claimedBy())
                .region(record.region())
                .environment(record.environment())
                .note(record.resourceType() + ":" + record.key().partition())
                .metadata(sanitizer.sanitize(auditRaw))
                .build();

        Map<String, String> context = new HashMap<>(payload);
        context.put(RuleFields.SLUG, record.slug());
        context.put("name", record.name());

        ClaimResult result = new ClaimResult(ResultStatus.SUCCESS, "Name claimed", record.name(),
                record.resourceType(), record.region(), record.environment(), record.slug(), record.claimedBy(),
                record.sortedMetadata(), rule.renderDisplay(context), rule.renderSummary(context), version, List.of());
        return appendAudit(entry) ? result : result.withWarning(ResultWarning.AUDIT_WRITE_FAILED);
    }

    /**
     * Index values to try. A template with a plain {index} placeholder needs a value on every attempt;
     * otherwise the first attempt goes without one. Only one attempt when the caller chose the index
     * or the rule does not use it.
     */
    List<String> indexCandidates(NamingRule rule, Map<String, String> payload) {
        List<String> candidates = new ArrayList<>();
        String given = payload.get(RuleFields.INDEX);
        if (!rule.usesField(RuleFields.INDEX) || (given != null && !given.isBlank())) {
            candidates.add(null);
            return candidates;
        }
        boolean indexRequired = rule.hasTemplate()
                && Templates.placeholders(rule.getNameTemplate()).contains(RuleFields.INDEX);
        if (!indexRequired) {
            candidates.add(null);
        }
        int next = 1;
        while (candidates.size() < options.getMaxClaimAttempts()) {
            candidates.add(String.format("%0" + options.getIndexWidth() + "d", next++));
        }
        return candidates;
    }

    // ========== Release ==========

    /**
     * Marks a claimed name as released. Requires {@link SecurityRole#CONTRIBUTOR} and ownership
     * (claimant or previous releaser) unless the caller is elevated.
     */
    public ReleaseResult release(ReleaseRequest request, AuthContext auth) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forRelease(correlationId, request.name(), actorOf(auth));
             Span span = tracing.startSpan(TracingService.RELEASE, spanAttributes(
                     "naming.name", request.name(),
                     "naming.region", request.region(),
                     "naming.environment", request.environment()))) {
            ReleaseResult result;
            try {
                requireRole(auth, SecurityRole.CONTRIBUTOR, "release names");
                result = doRelease(request, auth);
                span.setStatus(Span.SpanStatus.OK);
            } catch (NamingException e) {
                result = ReleaseResult.failure(ResultStatus.of(e.kind()), e.getMessage());
                span.setAttribute("naming.outcome", result.status().name());
                log.info("release.rejected status={} message={}", result.status(), e.getMessage());
            } catch (RuntimeException e) {
                span.fail(e);
                metrics.incrementRelease("error");
                log.error("release.failed name={}", request.name(), e);
                throw e;
            }
            metrics.incrementRelease(result.status().name().toLowerCase(Locale.ROOT));
            return result;
        }
    }

    private ReleaseResult doRelease(ReleaseRequest request, AuthContext auth) {
        ClaimKey key = keyOf(request.region(), request.environment(), request.name());
        if (request.expectedVersion() == null) {
            throw new ValidationException(
                    "expectedVersion is required. Read the name and release the version you read.");
        }
        VersionedClaim current = ledger.get(key);
        ClaimedName claim = current.claim();

        if (!auth.isElevated() && !auth.isActor(claim.claimedBy()) && !auth.isActor(claim.releasedBy())) {
            throw new AuthorizationException("Only the claimant or an administrator may release '" + key.name() + "'");
        }

        String reason = request.reason() == null || request.reason().isBlank()
                ? options.getDefaultReleaseReason()
                : sanitizer.sanitizeValue(request.reason());
        ClaimedName released = claim.release(auth.actor(), Instant.now(), reason);

        VersionToken version;
        try {
            version = ledger.replaceIfUnchanged(key, released, request.expectedVersion());
        } catch (ConflictException e) {
            throw new ConflictException("Name '" + key.name()
                    + "' was modified since it was read. Re-fetch its current state and retry.", e);
        }
        log.info("release.succeeded name={} partition={} version={}", key.name(), key.partition(), version);

        Map<String, Object> auditRaw = new LinkedHashMap<>(claim.metadata());
        auditRaw.putAll(claim.segments());
        auditRaw.put(RuleFields.REGION, claim.region());
        auditRaw.put(RuleFields.ENVIRONMENT, claim.environment());
        auditRaw.put(RuleFields.RESOURCE_TYPE, claim.resourceType());
        auditRaw.put(RuleFields.SLUG, claim.slug());

        AuditEntry entry = AuditEntry.builder()
                .action(AuditAction.RELEASED)
                .name(key.name())
                .actor(auth.actor())
                .region(key.region())
                .environment(key.environment())
                .note(reason)
                .metadata(sanitizer.sanitize(auditRaw))
                .build();

        ReleaseResult result = ReleaseResult.released(released, version);
        return appendAudit(entry) ? result : result.withWarning(ResultWarning.AUDIT_WRITE_FAILED);
    }

    // ========== Reads ==========

    /**
     * Current row and version of a name. Requires {@link SecurityRole#READER}.
     */
    public OperationResult<VersionedClaim> getClaim(String region, String environment, String name, AuthContext auth) {
        return execute("read claims", auth, SecurityRole.READER,
                () -> ledger.get(keyOf(region, environment, name)));
    }

    public OperationResult<SlugLookup> lookupSlug(String resourceType, AuthContext auth) {
        return execute("look up slugs", auth, SecurityRole.READER, () -> {
            SlugMapping mapping = slugResolver.resolveMapping(resourceType);
            return new SlugLookup(mapping.resourceType(), mapping.slug());
        });
    }

    /**
     * Applies an upstream slug snapshot that was fetched by the caller. Requires {@link SecurityRole#ADMIN}.
     */
    public OperationResult<SlugSyncService.SyncSummary> syncSlugs(String snapshot, AuthContext auth) {
        try (LogContext ctx = LogContext.forSync(LogContext.generateCorrelationId());
             Span span = tracing.startSpan(TracingService.SLUG_SYNC)) {
            OperationResult<SlugSyncService.SyncSummary> result =
                    execute("sync slugs", auth, SecurityRole.ADMIN, () -> slugSyncService.sync(snapshot));
            if (result.isSuccess()) {
                span.setAttribute("naming.slug.updated", result.value().updatedCount());
                span.setStatus(Span.SpanStatus.OK);
            } else {
                span.setStatus(Span.SpanStatus.ERROR);
            }
            return result;
        }
    }

    /**
     * Audit trail of one name, oldest first. Callers without an elevated role must be the
     * name's claimant or releaser.
     */
    public OperationResult<List<AuditEntry>> queryAudit(String region, String environment, String name,
                                                        AuthContext auth) {
        return execute("read audit records", auth, SecurityRole.READER, () -> {
            ClaimKey key = keyOf(region, environment, name);
            if (!auth.isElevated()) {
                ClaimedName claim = ledger.get(key).claim();
                if (!auth.isActor(claim.claimedBy()) && !auth.isActor(claim.releasedBy())) {
                    throw new AuthorizationException("Audit records of '" + key.name()
                            + "' are visible to its claimant or an administrator only");
                }
            }
            return ledger.auditTrail(key);
        });
    }

    /**
     * Filtered audit query, newest first. Callers without an elevated role only see their own
     * records; an absent actor filter defaults to the caller.
     */
    public OperationResult<List<AuditEntry>> queryAuditBulk(AuditQuery filters, AuthContext auth) {
        return execute("query audit records", auth, SecurityRole.READER,
                () -> ledger.queryAudit(scopeToCaller(filters, auth)));
    }

    /**
     * Same as {@link #queryAuditBulk(AuditQuery, AuthContext)} with raw request parameters.
     */
    public OperationResult<List<AuditEntry>> queryAuditBulk(String actor, String region, String environment,
                                                            String action, String start, String end,
                                                            AuthContext auth) {
        return execute("query audit records", auth, SecurityRole.READER, () -> {
            AuditQuery filters = AuditQuery.parse(actor, region, environment, action, start, end);
            return ledger.queryAudit(scopeToCaller(filters, auth));
        });
    }

    private static AuditQuery scopeToCaller(AuditQuery filters, AuthContext auth) {
        if (auth.isElevated()) {
            return filters;
        }
        if (filters.actor() == null) {
            return filters.withActor(auth.actor());
        }
        if (!auth.isActor(filters.actor())) {
            throw new AuthorizationException("Audit records of other users are visible to administrators only");
        }
        return filters;
    }

    public OperationResult<RuleDescription> describeRule(String resourceType, AuthContext auth) {
        return execute("describe rules", auth, SecurityRole.READER, () -> ruleStore.describeRule(resourceType));
    }

    public OperationResult<List<String>> listResourceTypes(AuthContext auth) {
        return execute("list resource types", auth, SecurityRole.READER, ruleStore::listResourceTypes);
    }

    // ========== User defaults ==========

    public OperationResult<Map<String, String>> getDefaults(String sessionId, AuthContext auth) {
        return execute("read defaults", auth, SecurityRole.READER,
                () -> settings.effectiveDefaults(auth.actor(), sessionId));
    }

    /**
     * Stores permanent defaults, or session defaults when a session id is given.
     */
    public OperationResult<Map<String, String>> saveDefaults(String sessionId, Map<String, ?> values,
                                                             AuthContext auth) {
        return execute("save defaults", auth, SecurityRole.CONTRIBUTOR, () -> {
            if (sessionId == null || sessionId.isBlank()) {
                settings.setPermanentDefaults(auth.actor(), values);
            } else {
                settings.setSessionDefaults(auth.actor(), sessionId, values);
            }
            return settings.effectiveDefaults(auth.actor(), sessionId);
        });
    }

    // ========== Helpers ==========

    private <T> OperationResult<T> execute(String operation, AuthContext auth, SecurityRole role, Supplier<T> action) {
        try {
            requireRole(auth, role, operation);
            return OperationResult.success(action.get());
        } catch (NamingException e) {
            log.debug("operation.rejected operation={} kind={} message={}", operation, e.kind(), e.getMessage());
            return OperationResult.failure(ResultStatus.of(e.kind()), e.getMessage());
        }
    }

    private static void requireRole(AuthContext auth, SecurityRole role, String operation) {
        if (auth == null || !auth.hasRole(role)) {
            throw new AuthorizationException("Role " + role + " is required to " + operation);
        }
    }

    private boolean appendAudit(AuditEntry entry) {
        try {
            ledger.appendAudit(entry);
            return true;
        } catch (RuntimeException e) {
            metrics.incrementAuditAppendFailed(entry.action().wireName());
            log.error("audit.append.failed action={} name={} partition={}",
                    entry.action().wireName(), entry.name(), entry.partition(), e);
            return false;
        }
    }

    private static Map<String, String> payloadOf(ClaimRequest request) {
        Map<String, String> payload = new HashMap<>();
        request.segments().forEach((rawKey, value) -> {
            String key = rawKey == null ? "" : rawKey.trim().toLowerCase(Locale.ROOT);
            if (!RuleFields.isOptionalSegment(key)) {
                throw new ValidationException("Unsupported field '" + rawKey + "'");
            }
            if (value != null && !value.isBlank()) {
                payload.put(key, value.trim().toLowerCase(Locale.ROOT));
            }
        });
        putIfPresent(payload, RuleFields.RESOURCE_TYPE, request.resourceType());
        putIfPresent(payload, RuleFields.REGION, request.region());
        putIfPresent(payload, RuleFields.ENVIRONMENT, request.environment());
        return payload;
    }

    private static void putIfPresent(Map<String, String> payload, String key, String value) {
        if (value != null && !value.isBlank()) {
            payload.put(key, value.trim());
        }
    }

    private static Map<String, String> usedSegments(NamingRule rule, Map<String, String> values) {
        Map<String, String> used = new TreeMap<>();
        for (String field : RuleFields.OPTIONAL_SEGMENTS) {
            String value = values.get(field);
            if (value != null && !value.isBlank() && rule.usesField(field)) {
                used.put(field, value);
            }
        }
        return used;
    }

    private static String required(Map<String, String> payload, String field) {
        String value = payload.get(field);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field(s): " + field);
        }
        return value;
    }

    private static String location(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field(s): " + field);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!LOCATION.matcher(normalized).matches()) {
            throw new ValidationException(field + " must be 1-32 lowercase letters or digits");
        }
        return normalized;
    }

    private static ClaimKey keyOf(String region, String environment, String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Missing required field(s): name");
        }
        String normalizedName = name.trim().toLowerCase(Locale.ROOT);
        if (!CLAIMED_NAME.matcher(normalizedName).matches()) {
            throw new ValidationException("name must contain only lowercase letters, digits and hyphens");
        }
        return ClaimKey.of(location(region, RuleFields.REGION), location(environment, RuleFields.ENVIRONMENT),
                normalizedName);
    }

    private String metricType(String resourceType) {
        try {
            String type = RuleStore.normalizeType(resourceType);
            return ruleStore.current().rules().containsKey(type) ? type : "default";
        } catch (ValidationException e) {
            return "invalid";
        }
    }

    private static String actorOf(AuthContext auth) {
        return auth != null ? auth.actor() : null;
    }

    private static Map<String, String> spanAttributes(String... keyValues) {
        Map<String, String> attributes = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                attributes.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return attributes;
    }
}
