package com.object.spatial.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Runtime spans are {@link SpanKind#INTERNAL}; attribute keys are namespaced
 * under {@code osp.}.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_NAME = "object-spatial-runtime";
    private static final String ATTRIBUTE_PREFIX = "osp.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    /**
     * Uses the tracer of the globally registered OpenTelemetry instance.
     */
    public static OpenTelemetryTracingService fromGlobal() {
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        }
        return new RuntimeSpan(builder.startSpan());
    }

    private static final class RuntimeSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        RuntimeSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void attribute(String key, String value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void attribute(String key, long value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void event(String name) {
            delegate.addEvent(name);
        }

        @Override
        public void complete() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
