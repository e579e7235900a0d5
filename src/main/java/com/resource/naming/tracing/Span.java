package com.resource.naming.tracing;

/**
 * A unit of work in a distributed trace. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracing.startSpan("naming.claim")) {
 *     span.setAttribute("naming.resource_type", "storage_account");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    /**
     * Span that records nothing.
     */
    Span NOOP = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the exception and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
