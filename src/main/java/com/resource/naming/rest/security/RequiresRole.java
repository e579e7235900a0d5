package com.resource.naming.rest.security;

import com.resource.naming.security.SecurityRole;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a REST endpoint or resource class with the minimum security role required.
 * Applied at method level to override class-level defaults.
 *
 * <p>Example:</p>
 * <pre>
 * &#64;RequiresRole(SecurityRole.CONTRIBUTOR)
 * &#64;POST
 * &#64;Path("/claim")
 * public Response claim(ClaimNameRequest request) { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresRole {

    /**
     * The minimum role required to access this endpoint.
     */
    SecurityRole value();
}
