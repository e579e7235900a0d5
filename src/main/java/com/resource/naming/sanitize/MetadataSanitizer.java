package com.resource.naming.sanitize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Normalizes caller-supplied metadata into bounded, storage-safe strings.
 *
 * <p>Every persisted metadata map passes through {@link #sanitize(Map)}. The result is
 * deterministic, keeps every non-null entry (colliding keys get a {@code _2}, {@code _3}...
 * suffix), and is a fixed point: sanitizing a sanitized map returns an equal map.</p>
 *
 * <p>This class never throws on malformed input.</p>
 */
public class MetadataSanitizer {
    private static final Logger log = LoggerFactory.getLogger(MetadataSanitizer.class);

    public static final int MAX_KEY_LENGTH = 255;
    public static final int MAX_VALUE_LENGTH = 32_768;
    public static final String FALLBACK_KEY = "UnknownKey";
    public static final String TRUNCATION_MARKER = "...[truncated]";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");
    private static final Pattern RESERVED_KEY_CHARS = Pattern.compile("['\"`<>|*/?\\\\]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAKS_AND_TABS = Pattern.compile("[\\r\\n\\t]+");

    private final ObjectMapper objectMapper;

    public MetadataSanitizer() {
        this.objectMapper = JsonMapper.builder()
                .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * Sanitizes a whole map. Null values are dropped; the result is sorted by key.
     */
    public Map<String, String> sanitize(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyMap();
        }

        List<Map.Entry<String, ?>> entries = new ArrayList<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getValue() != null) {
                entries.add(entry);
            }
        }
        // Raw key order decides which colliding entry keeps the bare key.
        entries.sort((a, b) -> compareKeys(a.getKey(), b.getKey()));

        Map<String, String> sanitized = new TreeMap<>();
        Set<String> used = new HashSet<>();
        for (Map.Entry<String, ?> entry : entries) {
            String key = uniqueKey(sanitizeKey(entry.getKey()), used);
            used.add(key);
            sanitized.put(key, sanitizeValue(entry.getValue()));
        }
        return sanitized;
    }

    /**
     * Removes control characters, replaces reserved characters with {@code _}, collapses
     * whitespace and bounds the length. Empty results become {@value #FALLBACK_KEY}.
     */
    public String sanitizeKey(String key) {
        if (key == null) {
            return FALLBACK_KEY;
        }
        String cleaned = CONTROL_CHARS.matcher(key).replaceAll("");
        cleaned = RESERVED_KEY_CHARS.matcher(cleaned).replaceAll("_");
        cleaned = WHITESPACE_RUN.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.length() > MAX_KEY_LENGTH) {
            cleaned = cleaned.substring(0, MAX_KEY_LENGTH).trim();
        }
        return cleaned.isEmpty() ? FALLBACK_KEY : cleaned;
    }

    /**
     * Renders a value as a string, strips control characters and bounds its length,
     * appending {@value #TRUNCATION_MARKER} when it had to be cut.
     */
    public String sanitizeValue(Object value) {
        String text = render(value);
        text = LINE_BREAKS_AND_TABS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("").trim();
        if (text.length() > MAX_VALUE_LENGTH) {
            text = text.substring(0, MAX_VALUE_LENGTH - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
        }
        return text;
    }

    private String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                log.debug("metadata.value.serialize_failed type={} error={}", value.getClass().getSimpleName(), e.getMessage());
                return safeToString(value);
            }
        }
        return safeToString(value);
    }

    private static String safeToString(Object value) {
        try {
            String text = value.toString();
            return text != null ? text : "";
        } catch (RuntimeException e) {
            log.debug("metadata.value.render_failed type={}", value.getClass().getSimpleName());
            return "[unrenderable]";
        }
    }

    private static String uniqueKey(String key, Set<String> used) {
        if (!used.contains(key)) {
            return key;
        }
        for (int n = 2; ; n++) {
            String suffix = "_" + n;
            String base = key.length() + suffix.length() > MAX_KEY_LENGTH
                    ? key.substring(0, MAX_KEY_LENGTH - suffix.length()).trim()
                    : key;
            String candidate = base + suffix;
            if (!used.contains(candidate)) {
                return candidate;
            }
        }
    }

    private static int compareKeys(String a, String b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }
}
