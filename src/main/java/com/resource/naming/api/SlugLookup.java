package com.resource.naming.api;

/**
 * Result payload of a slug lookup.
 */
public record SlugLookup(String resourceType, String slug) {}
