package com.object.spatial.api;

import com.object.spatial.walker.ExitPolicy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide runtime settings, immutable once built.
 * The global values are the only state shared by concurrent walkers.
 */
public class RuntimeOptions {

    private static final int DEFAULT_FLOW_POOL_SIZE = 4;
    private static final long DEFAULT_FLOW_TIMEOUT_MS = 30_000;

    private final ExitPolicy exitPolicy;
    private final Map<String, Object> globals;
    private final int flowPoolSize;
    private final long flowTimeoutMs;
    private final long asyncTimeoutMs;

    private RuntimeOptions(Builder builder) {
        this.exitPolicy = builder.exitPolicy;
        this.globals = Map.copyOf(builder.globals);
        this.flowPoolSize = builder.flowPoolSize;
        this.flowTimeoutMs = builder.flowTimeoutMs;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
    }

    public ExitPolicy getExitPolicy() {
        return exitPolicy;
    }

    public Map<String, Object> getGlobals() {
        return globals;
    }

    public int getFlowPoolSize() {
        return flowPoolSize;
    }

    public long getFlowTimeoutMs() {
        return flowTimeoutMs;
    }

    /**
     * Timeout for asynchronous spawns in milliseconds; 0 means none.
     */
    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public static RuntimeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ExitPolicy exitPolicy = ExitPolicy.ONCE_PER_NODE;
        private final Map<String, Object> globals = new LinkedHashMap<>();
        private int flowPoolSize = DEFAULT_FLOW_POOL_SIZE;
        private long flowTimeoutMs = DEFAULT_FLOW_TIMEOUT_MS;
        private long asyncTimeoutMs = 0;

        public Builder exitPolicy(ExitPolicy exitPolicy) {
            this.exitPolicy = Objects.requireNonNull(exitPolicy, "exitPolicy is required");
            return this;
        }

        /**
         * Adds a global value readable by every ability through {@code ctx.global(name)}.
         */
        public Builder global(String name, Object value) {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(value, "global values must not be null");
            globals.put(name, value);
            return this;
        }

        public Builder globals(Map<String, Object> values) {
            values.forEach(this::global);
            return this;
        }

        public Builder flowPoolSize(int flowPoolSize) {
            if (flowPoolSize <= 0) {
                throw new IllegalArgumentException("flowPoolSize must be positive");
            }
            this.flowPoolSize = flowPoolSize;
            return this;
        }

        public Builder flowTimeoutMs(long flowTimeoutMs) {
            if (flowTimeoutMs < 0) {
                throw new IllegalArgumentException("flowTimeoutMs must be >= 0");
            }
            this.flowTimeoutMs = flowTimeoutMs;
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs < 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be >= 0");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public RuntimeOptions build() {
            return new RuntimeOptions(this);
        }
    }
}
