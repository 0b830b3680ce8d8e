package com.object.spatial.tracing;

import java.util.Map;

/**
 * Opens spans around walker runs and sweeps.
 * {@link NoOpTracingService} is used unless a tracer is configured.
 */
public interface TracingService {

    /**
     * @param attributes initial span attributes; may be empty
     */
    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
