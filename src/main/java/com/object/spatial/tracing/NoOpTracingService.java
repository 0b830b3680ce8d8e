package com.object.spatial.tracing;

import java.util.Map;

/**
 * Tracing service that records nothing. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void attribute(String key, String value) {
        }

        @Override
        public void attribute(String key, long value) {
        }

        @Override
        public void event(String name) {
        }

        @Override
        public void complete() {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
