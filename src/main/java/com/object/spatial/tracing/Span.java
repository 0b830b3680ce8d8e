package com.object.spatial.tracing;

/**
 * Traced unit of runtime work, such as one walker run or one sweep.
 * Closing the span ends it; a span that was neither completed nor failed ends unset.
 */
public interface Span extends AutoCloseable {

    void attribute(String key, String value);

    void attribute(String key, long value);

    /**
     * Records something that happened during the span, for example {@code walker.disengaged}.
     */
    void event(String name);

    void complete();

    /**
     * Records the failure and marks the span as errored.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
