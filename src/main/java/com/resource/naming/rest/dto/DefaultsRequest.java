package com.resource.naming.rest.dto;

import java.util.Map;

/**
 * Request DTO for storing user defaults. With a session id the values apply to that
 * session only; otherwise they are permanent.
 */
public record DefaultsRequest(String sessionId, Map<String, String> values) {

    public DefaultsRequest {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values are required");
        }
    }
}
