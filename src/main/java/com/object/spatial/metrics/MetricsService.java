package com.object.spatial.metrics;

import com.object.spatial.core.model.Phase;
import com.object.spatial.walker.WalkerOutcome;

import java.time.Duration;

/**
 * Interface for recording runtime metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordSpawnDuration(String walkerType, WalkerOutcome outcome, Duration duration);

    void incrementAbilityInvocation(Phase phase);

    void recordPathLength(int length);

    void recordReportCount(int count);

    void incrementDisengaged(String walkerType);

    void recordReclaimed(int elements);
}
