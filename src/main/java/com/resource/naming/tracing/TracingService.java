package com.resource.naming.tracing;

import java.util.Map;

/**
 * Tracing integration point. {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    String CLAIM = "naming.claim";
    String RELEASE = "naming.release";
    String SLUG_SYNC = "naming.slug.sync";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
