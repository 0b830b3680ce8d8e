package com.object.spatial.metrics;

import com.object.spatial.core.model.Phase;
import com.object.spatial.walker.WalkerOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSpawnDuration(String walkerType, WalkerOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementAbilityInvocation(Phase phase) {
    }

    @Override
    public void recordPathLength(int length) {
    }

    @Override
    public void recordReportCount(int count) {
    }

    @Override
    public void incrementDisengaged(String walkerType) {
    }

    @Override
    public void recordReclaimed(int elements) {
    }
}
