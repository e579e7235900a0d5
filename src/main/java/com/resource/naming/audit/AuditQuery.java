package com.resource.naming.audit;

import com.resource.naming.error.ValidationException;
import com.resource.naming.security.AuthContext;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validated filter set for bulk audit queries. Every field is optional.
 * Values are format-checked here, so stores only ever see well-formed filters.
 */
public record AuditQuery(
        String actor,
        String region,
        String environment,
        AuditAction action,
        Instant start,
        Instant end
) {
    private static final Pattern LOCATION = Pattern.compile("^[a-z0-9]{1,32}$");

    public AuditQuery {
        actor = normalize(actor, AuthContext.ACTOR_FORMAT, "actor");
        region = normalize(region, LOCATION, "region");
        environment = normalize(environment, LOCATION, "environment");
        if (start != null && end != null && start.isAfter(end)) {
            throw new ValidationException("start must not be after end");
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null);
    }

    /**
     * Builds a query from raw request parameters.
     * Timestamps accept ISO-8601 instants, offset or local date-times (read as UTC), or plain dates;
     * a plain {@code end} date covers that whole day.
     *
     * @throws ValidationException if any value is malformed
     */
    public static AuditQuery parse(String actor, String region, String environment,
                                   String action, String start, String end) {
        return new AuditQuery(
                blankToNull(actor),
                blankToNull(region),
                blankToNull(environment),
                blankToNull(action) != null ? AuditAction.fromString(action) : null,
                parseTime(blankToNull(start), "start", false),
                parseTime(blankToNull(end), "end", true));
    }

    public AuditQuery withActor(String newActor) {
        return new AuditQuery(newActor, region, environment, action, start, end);
    }

    /**
     * In-memory evaluation of this filter, shared by stores that cannot filter natively.
     */
    public boolean matches(AuditEntry entry) {
        if (actor != null && !actor.equalsIgnoreCase(entry.actor())) {
            return false;
        }
        if (region != null && !region.equals(entry.region())) {
            return false;
        }
        if (environment != null && !environment.equals(entry.environment())) {
            return false;
        }
        if (action != null && action != entry.action()) {
            return false;
        }
        if (start != null && entry.timestamp().isBefore(start)) {
            return false;
        }
        return end == null || !entry.timestamp().isAfter(end);
    }

    private static String normalize(String value, Pattern pattern, String field) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!pattern.matcher(normalized).matches()) {
            throw new ValidationException(field + " filter has an invalid format");
        }
        return normalized;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Instant parseTime(String value, String field, boolean endOfDay) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // try the wider formats below
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the wider formats below
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try a plain date
        }
        try {
            LocalDate date = LocalDate.parse(value);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusNanos(1)
                    : date.atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be an ISO-8601 timestamp or date", e);
        }
    }
}
