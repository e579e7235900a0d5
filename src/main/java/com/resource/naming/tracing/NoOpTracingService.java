package com.resource.naming.tracing;

import java.util.Map;

/**
 * Used when no OpenTelemetry SDK is on the classpath, and in tests.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return Span.NOOP;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return Span.NOOP;
    }
}
