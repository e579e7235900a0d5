package com.resource.naming.settings;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.resource.naming.error.ValidationException;
import com.resource.naming.rules.RuleFields;
import com.resource.naming.sanitize.MetadataSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user defaults for claim payloads.
 * Permanent defaults live until replaced; session defaults expire after a period of inactivity
 * (one hour unless configured), and every read of a live session extends it.
 */
public class UserSettingsService {
    private static final Logger log = LoggerFactory.getLogger(UserSettingsService.class);

    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofHours(1);

    /**
     * Payload fields a default may be stored for.
     */
    public static final Set<String> ALLOWED_KEYS;

    static {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(RuleFields.REGION);
        keys.add(RuleFields.ENVIRONMENT);
        keys.addAll(RuleFields.OPTIONAL_SEGMENTS);
        ALLOWED_KEYS = Set.copyOf(keys);
    }

    private final Map<String, Map<String, String>> permanent = new ConcurrentHashMap<>();
    private final Cache<SessionKey, Map<String, String>> sessions;
    private final MetadataSanitizer sanitizer;

    public UserSettingsService() {
        this(DEFAULT_SESSION_TIMEOUT, Ticker.systemTicker(), new MetadataSanitizer());
    }

    public UserSettingsService(Duration sessionTimeout, Ticker ticker, MetadataSanitizer sanitizer) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(sessionTimeout)
                .ticker(ticker)
                .build();
        this.sanitizer = sanitizer;
    }

    public void setPermanentDefaults(String user, Map<String, ?> values) {
        permanent.put(normalizeUser(user), normalize(values));
        log.debug("settings.permanent.updated user={}", normalizeUser(user));
    }

    public void setSessionDefaults(String user, String session, Map<String, ?> values) {
        if (session == null || session.isBlank()) {
            throw new ValidationException("session id must be provided for session defaults");
        }
        sessions.put(new SessionKey(normalizeUser(user), session.trim()), normalize(values));
    }

    public void clearSession(String user, String session) {
        if (session != null) {
            sessions.invalidate(new SessionKey(normalizeUser(user), session.trim()));
        }
    }

    /**
     * Permanent defaults overlaid by the live session's defaults, if any.
     */
    public Map<String, String> effectiveDefaults(String user, String session) {
        String normalizedUser = normalizeUser(user);
        Map<String, String> defaults = new TreeMap<>(permanent.getOrDefault(normalizedUser, Map.of()));
        if (session != null && !session.isBlank()) {
            Map<String, String> sessionValues = sessions.getIfPresent(new SessionKey(normalizedUser, session.trim()));
            if (sessionValues != null) {
                defaults.putAll(sessionValues);
            }
        }
        return defaults;
    }

    /**
     * Fills payload fields that are absent or blank. Caller-supplied values always win.
     */
    public Map<String, String> applyDefaults(String user, String session, Map<String, String> payload) {
        Map<String, String> merged = new HashMap<>(payload);
        effectiveDefaults(user, session).forEach((key, value) -> {
            String current = merged.get(key);
            if (current == null || current.isBlank()) {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private Map<String, String> normalize(Map<String, ?> values) {
        Map<String, String> normalized = new TreeMap<>();
        if (values == null) {
            return normalized;
        }
        values.forEach((rawKey, rawValue) -> {
            String key = rawKey == null ? "" : rawKey.trim().toLowerCase(Locale.ROOT);
            if (!ALLOWED_KEYS.contains(key)) {
                throw new ValidationException("Unsupported default '" + rawKey + "'");
            }
            if (rawValue != null) {
                String value = sanitizer.sanitizeValue(rawValue);
                if (!value.isEmpty()) {
                    normalized.put(key, value);
                }
            }
        });
        return Map.copyOf(normalized);
    }

    private static String normalizeUser(String user) {
        if (user == null || user.isBlank()) {
            throw new ValidationException("user id is required");
        }
        return user.trim().toLowerCase(Locale.ROOT);
    }

    private record SessionKey(String user, String session) {}
}
