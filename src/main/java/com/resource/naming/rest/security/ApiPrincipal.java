package com.resource.naming.rest.security;

import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;

import java.security.Principal;
import java.util.Locale;
import java.util.Objects;

/**
 * The caller behind an API key: the actor name recorded on claims and audit entries, and its role.
 */
public record ApiPrincipal(String actor, SecurityRole role) implements Principal {

    public ApiPrincipal {
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(role, "role is required");
        if (actor.isBlank()) {
            throw new IllegalArgumentException("actor must not be blank");
        }
        if (!AuthContext.isValidActor(actor)) {
            throw new IllegalArgumentException("actor must match " + AuthContext.ACTOR_FORMAT.pattern());
        }
        actor = actor.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return actor;
    }

    public AuthContext toAuthContext() {
        return AuthContext.of(actor, role);
    }
}
