package com.resource.naming.rest.security;

import com.resource.naming.error.ConfigurationException;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for API key-based security.
 * Maps API keys to the actor and role they authenticate as.
 *
 * <p>Populated by the CDI producer from MicroProfile Config; each entry is {@code actor:key}:</p>
 * <pre>
 * naming.security.enabled=true
 * naming.security.api-key-header=X-API-Key
 * naming.security.admin-keys=ops:nm-ak-admin-xxxx
 * naming.security.contributor-keys=alice:nm-ak-alice-xxxx,bob:nm-ak-bob-xxxx
 * naming.security.reader-keys=dashboard:nm-ak-reader-xxxx
 * </pre>
 */
public class SecurityConfig {

    /** Actor used for every request when security is disabled. */
    public static final String ANONYMOUS_ACTOR = "anonymous";

    private final boolean enabled;
    private final String apiKeyHeader;
    private final Map<String, ApiPrincipal> apiKeys; // key value -> principal

    private SecurityConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.apiKeyHeader = builder.apiKeyHeader;
        this.apiKeys = Collections.unmodifiableMap(new HashMap<>(builder.apiKeys));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    /**
     * Looks up the principal associated with an API key.
     *
     * @param apiKey the API key value
     * @return the associated principal, or null if the key is not recognized
     */
    public ApiPrincipal getPrincipalForKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        return apiKeys.get(apiKey);
    }

    public boolean isValidKey(String apiKey) {
        return apiKey != null && apiKeys.containsKey(apiKey);
    }

    public int keyCount() {
        return apiKeys.size();
    }

    /**
     * Creates a disabled security configuration. Every request then runs as
     * {@value #ANONYMOUS_ACTOR} with the ADMIN role.
     */
    public static SecurityConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String apiKeyHeader = "X-API-Key";
        private final Map<String, ApiPrincipal> apiKeys = new HashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder apiKeyHeader(String apiKeyHeader) {
            if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
                throw new IllegalArgumentException("apiKeyHeader must not be null or blank");
            }
            this.apiKeyHeader = apiKeyHeader;
            return this;
        }

        public Builder addKey(String key, String actor, SecurityRole role) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("API key must not be null or blank");
            }
            if (actor == null || actor.isBlank()) {
                throw new IllegalArgumentException("Actor must not be null or blank");
            }
            if (role == null) {
                throw new IllegalArgumentException("Security role must not be null");
            }
            if (!AuthContext.isValidActor(actor)) {
                throw new ConfigurationException("Actor '" + actor.trim() + "' must match "
                        + AuthContext.ACTOR_FORMAT.pattern() + " (case-insensitive)");
            }
            this.apiKeys.put(key, new ApiPrincipal(actor, role));
            return this;
        }

        /**
         * Adds {@code actor:key} entries with the same role.
         */
        public Builder addKeys(List<String> entries, SecurityRole role) {
            if (entries == null) return this;
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                int separator = entry.indexOf(':');
                if (separator <= 0 || separator == entry.length() - 1) {
                    throw new IllegalArgumentException("API key entries must have the form 'actor:key'");
                }
                addKey(entry.substring(separator + 1).trim(), entry.substring(0, separator), role);
            }
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityConfig{" +
                "enabled=" + enabled +
                ", apiKeyHeader='" + apiKeyHeader + '\'' +
                ", keyCount=" + apiKeys.size() +
                '}';
    }
}
