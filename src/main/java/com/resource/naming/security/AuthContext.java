package com.resource.naming.security;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Request-scoped caller identity and roles. Built by the transport layer, never persisted.
 * Actor names are lowercased and must match {@link #ACTOR_FORMAT}, the same format the audit
 * actor filter accepts.
 */
public record AuthContext(String actor, Set<SecurityRole> roles) {

    public static final Pattern ACTOR_FORMAT = Pattern.compile("^[a-z0-9._@-]{1,128}$");

    public AuthContext {
        Objects.requireNonNull(actor, "actor is required");
        actor = actor.trim().toLowerCase(Locale.ROOT);
        if (actor.isEmpty()) {
            throw new IllegalArgumentException("actor must not be blank");
        }
        if (!ACTOR_FORMAT.matcher(actor).matches()) {
            throw new IllegalArgumentException("actor '" + actor + "' must match " + ACTOR_FORMAT.pattern());
        }
        roles = roles == null || roles.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(roles));
    }

    public static AuthContext of(String actor, SecurityRole... roles) {
        return new AuthContext(actor, roles.length == 0 ? Set.of() : Set.of(roles));
    }

    public static AuthContext of(String actor, Collection<SecurityRole> roles) {
        return new AuthContext(actor, roles == null ? Set.of() : Set.copyOf(roles));
    }

    /**
     * True if the trimmed, lowercased value is a usable actor name.
     */
    public static boolean isValidActor(String actor) {
        return actor != null && ACTOR_FORMAT.matcher(actor.trim().toLowerCase(Locale.ROOT)).matches();
    }

    /**
     * Returns true if any held role satisfies the required one.
     */
    public boolean hasRole(SecurityRole required) {
        return roles.stream().anyMatch(r -> r.hasPermission(required));
    }

    public boolean isElevated() {
        return roles.stream().anyMatch(SecurityRole::isElevated);
    }

    /**
     * Case-insensitive identity match against a stored actor value.
     */
    public boolean isActor(String other) {
        return other != null && actor.equalsIgnoreCase(other.trim());
    }
}
