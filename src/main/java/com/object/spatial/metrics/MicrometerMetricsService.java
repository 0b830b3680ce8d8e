package com.object.spatial.metrics;

import com.object.spatial.core.model.Phase;
import com.object.spatial.walker.WalkerOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code osp.walker.spawn.duration}: Timer (tags: walkerType, outcome)</li>
 *   <li>{@code osp.ability.invocations}: Counter (tag: phase)</li>
 *   <li>{@code osp.walker.path.length}: DistributionSummary</li>
 *   <li>{@code osp.walker.reports}: DistributionSummary</li>
 *   <li>{@code osp.walker.disengaged}: Counter (tag: walkerType)</li>
 *   <li>{@code osp.graph.reclaimed}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary pathLengthSummary;
    private final DistributionSummary reportCountSummary;
    private final Counter reclaimedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pathLengthSummary = DistributionSummary.builder("osp.walker.path.length")
                .description("Number of elements entered per walker run")
                .register(registry);
        this.reportCountSummary = DistributionSummary.builder("osp.walker.reports")
                .description("Number of values reported per walker run")
                .register(registry);
        this.reclaimedCounter = Counter.builder("osp.graph.reclaimed")
                .description("Number of nodes and edges reclaimed by sweeps")
                .register(registry);
    }

    @Override
    public void recordSpawnDuration(String walkerType, WalkerOutcome outcome, Duration duration) {
        String key = walkerType + ":" + outcome.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("osp.walker.spawn.duration")
                        .description("Duration of walker runs")
                        .tag("walkerType", walkerType)
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementAbilityInvocation(Phase phase) {
        String key = "ability:" + phase.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("osp.ability.invocations")
                        .description("Number of ability invocations")
                        .tag("phase", phase.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordPathLength(int length) {
        pathLengthSummary.record(length);
    }

    @Override
    public void recordReportCount(int count) {
        reportCountSummary.record(count);
    }

    @Override
    public void incrementDisengaged(String walkerType) {
        String key = "disengaged:" + walkerType;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("osp.walker.disengaged")
                        .description("Number of walkers stopped by disengage")
                        .tag("walkerType", walkerType)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordReclaimed(int elements) {
        reclaimedCounter.increment(elements);
    }
}
