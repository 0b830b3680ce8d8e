package com.object.spatial.walker;

import com.object.spatial.ability.Ability;
import com.object.spatial.ability.ElementAbilityRegistry;
import com.object.spatial.api.RuntimeOptions;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.core.model.Phase;
import com.object.spatial.error.WalkerExecutionException;
import com.object.spatial.flow.FlowExecutor;
import com.object.spatial.flow.FlowHandle;
import com.object.spatial.graph.GraphStore;
import com.object.spatial.metrics.MetricsService;
import com.object.spatial.visit.TraversalPath;
import com.object.spatial.visit.VisitResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Drives a walker from {@link WalkerState#CREATED} to {@link WalkerState#DONE}.
 *
 * <p>Each step dequeues the front target, appends it to the path and runs its entry
 * abilities. Visits issued during an entry belong to that element's frame. An element
 * that enqueued nothing completes at once and waits in its parent frame; one that did
 * is pushed on the pending-exit stack. Whenever the top frame has nothing pending it is
 * popped: exits of its completed members run in entry order, then the owner's exit.</p>
 *
 * <p>At each element the walker's own abilities and those declared on the element's
 * archetype both run. On entry the walker's go first, then the element's for any
 * walker, then the element's for this walker type; exits run in the reverse order.
 * Spawn abilities run once before the first entry, finish abilities once after the
 * last exit.</p>
 *
 * <p>Ability failures abort the loop and surface as {@link WalkerExecutionException}
 * carrying the reports and path gathered so far.</p>
 */
public class WalkerEngine {
    private static final Logger log = LoggerFactory.getLogger(WalkerEngine.class);

    private final GraphStore graphStore;
    private final VisitResolver visitResolver;
    private final FlowExecutor flowExecutor;
    private final MetricsService metrics;
    private final RuntimeOptions options;
    private final ElementAbilityRegistry elementAbilities;

    public WalkerEngine(GraphStore graphStore, VisitResolver visitResolver, FlowExecutor flowExecutor,
                        MetricsService metrics, RuntimeOptions options) {
        this(graphStore, visitResolver, flowExecutor, metrics, options, new ElementAbilityRegistry());
    }

    public WalkerEngine(GraphStore graphStore, VisitResolver visitResolver, FlowExecutor flowExecutor,
                        MetricsService metrics, RuntimeOptions options, ElementAbilityRegistry elementAbilities) {
        this.elementAbilities = Objects.requireNonNull(elementAbilities, "elementAbilities is required");
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore is required");
        this.visitResolver = Objects.requireNonNull(visitResolver, "visitResolver is required");
        this.flowExecutor = Objects.requireNonNull(flowExecutor, "flowExecutor is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Runs the walker on the calling thread until its queue and pending-exit stack
     * drain or it disengages.
     *
     * @param seeds initial queue contents, already expanded (an edge followed by its target)
     * @return how the walker finished
     * @throws WalkerExecutionException if an ability or visit filter throws
     */
    public WalkerOutcome run(Walker walker, List<ElementId> seeds) {
        walker.start();
        TraversalFrame spawnFrame = TraversalFrame.forSpawn();
        walker.pushFrame(spawnFrame);
        enqueue(walker, seeds, -1, spawnFrame);

        WalkerOutcome outcome = WalkerOutcome.FAILED;
        try {
            if (!seeds.isEmpty()) {
                runOnce(walker, walker.getType().getSpawnAbilities(), seeds.get(0), Phase.ENTRY, spawnFrame);
            }
            while (!walker.isDisengaged()) {
                QueuedVisit next = walker.poll();
                if (next == null) {
                    break;
                }
                step(walker, next);
                if (!walker.isDisengaged()) {
                    unwind(walker);
                }
            }
            if (!walker.isDisengaged()) {
                List<ElementId> path = walker.getPath();
                ElementId last = path.isEmpty() ? (seeds.isEmpty() ? null : seeds.get(0)) : path.get(path.size() - 1);
                if (last != null) {
                    runOnce(walker, walker.getType().getFinishAbilities(), last, Phase.EXIT, spawnFrame);
                }
            }
            outcome = walker.isDisengaged() ? WalkerOutcome.DISENGAGED : WalkerOutcome.COMPLETED;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new WalkerExecutionException(walker.getId(), walker.getReports(), walker.getPath(), e);
        } finally {
            // Errors thrown by abilities leave outcome at FAILED
            if (walker.getState() != WalkerState.DONE) {
                walker.finish(outcome);
            }
        }

        log.debug("Walker {} finished {}: path={}, reports={}",
                walker.getId(), outcome, walker.getPath().size(), walker.getReports().size());
        return outcome;
    }

    private void step(Walker walker, QueuedVisit next) throws Exception {
        TraversalFrame origin = next.origin();
        GraphElement element = walker.isIgnored(next.target())
                ? null
                : graphStore.find(next.target()).orElse(null);
        if (element == null) {
            log.debug("Skipping {} (ignored or deleted since it was queued)", next.target());
            origin.visitCompleted();
            return;
        }

        walker.appendPath(element.getId());
        TraversalFrame frame = TraversalFrame.forEntry(element, origin);
        runAbilities(walker, element, Phase.ENTRY, frame);
        if (walker.isDisengaged()) {
            return;
        }
        if (frame.hasPending()) {
            walker.pushFrame(frame);
        } else {
            origin.addCompleted(element);
            origin.visitCompleted();
        }
    }

    private void unwind(Walker walker) throws Exception {
        while (!walker.isDisengaged()) {
            TraversalFrame top = walker.peekFrame();
            if (top == null || top.hasPending()) {
                return;
            }
            walker.popFrame();
            TraversalFrame visitFrame = top.openAncestor();
            for (GraphElement member : top.drainCompleted()) {
                runExit(walker, member, visitFrame);
                if (walker.isDisengaged()) {
                    return;
                }
            }
            if (top.owner() != null) {
                runExit(walker, top.owner(), visitFrame);
                top.parent().visitCompleted();
            } else if (top.hasPending()) {
                // exits of top-level elements re-routed the walker
                walker.pushFrame(top);
            }
        }
    }

    private void runExit(Walker walker, GraphElement element, TraversalFrame visitFrame) throws Exception {
        if (options.getExitPolicy() == ExitPolicy.ONCE_PER_NODE && !walker.markExited(element.getId())) {
            return;
        }
        GraphElement current = graphStore.find(element.getId()).orElse(null);
        if (current == null) {
            log.debug("Skipping exit of {} (deleted since it was entered)", element.getId());
            return;
        }
        runAbilities(walker, current, Phase.EXIT, visitFrame);
    }

    private void runAbilities(Walker walker, GraphElement element, Phase phase, TraversalFrame visitFrame)
            throws Exception {
        List<Ability> own = walker.getType().getAbilities().resolve(element.getType(), phase);
        List<Ability> forAny = elementAbilities.resolveForAnyWalker(element.getType(), phase);
        List<Ability> forType = elementAbilities.resolveForWalker(
                element.getType(), walker.getType().getArchetype(), phase);
        List<Ability> ordered = new ArrayList<>(own.size() + forAny.size() + forType.size());
        if (phase == Phase.ENTRY) {
            ordered.addAll(own);
            ordered.addAll(forAny);
            ordered.addAll(forType);
        } else {
            ordered.addAll(forType);
            ordered.addAll(forAny);
            ordered.addAll(own);
        }
        invoke(walker, ordered, new Context(walker, element, phase, visitFrame));
    }

    /**
     * Runs spawn or finish abilities at {@code location}; skipped if it no longer exists.
     */
    private void runOnce(Walker walker, List<Ability> abilities, ElementId location, Phase phase,
                         TraversalFrame visitFrame) throws Exception {
        if (abilities.isEmpty()) {
            return;
        }
        GraphElement here = graphStore.find(location).orElse(null);
        if (here == null) {
            log.debug("Skipping {} abilities of walker {}: {} no longer exists",
                    phase == Phase.ENTRY ? "spawn" : "finish", walker.getId(), location);
            return;
        }
        invoke(walker, abilities, new Context(walker, here, phase, visitFrame));
    }

    private void invoke(Walker walker, List<Ability> abilities, Context ctx) throws Exception {
        for (Ability ability : abilities) {
            metrics.incrementAbilityInvocation(ctx.phase());
            ability.execute(ctx);
            if (walker.isDisengaged()) {
                log.debug("Walker {} disengaged at {}", walker.getId(), ctx.here().getId());
                return;
            }
        }
    }

    private boolean enqueue(Walker walker, List<ElementId> targets, int index, TraversalFrame frame) {
        List<QueuedVisit> visits = new ArrayList<>(targets.size());
        for (ElementId target : targets) {
            if (!walker.isIgnored(target)) {
                visits.add(new QueuedVisit(target, frame));
            }
        }
        if (visits.isEmpty()) {
            return false;
        }
        walker.insert(index, visits);
        frame.expect(visits.size());
        return true;
    }

    private final class Context implements WalkerContext {
        private final Walker walker;
        private final GraphElement here;
        private final Phase phase;
        private final TraversalFrame visitFrame;

        Context(Walker walker, GraphElement here, Phase phase, TraversalFrame visitFrame) {
            this.walker = walker;
            this.here = here;
            this.phase = phase;
            this.visitFrame = visitFrame;
        }

        @Override
        public Walker walker() {
            return walker;
        }

        @Override
        public GraphElement here() {
            return here;
        }

        @Override
        public Node hereNode() {
            if (here instanceof Node node) {
                return node;
            }
            throw new IllegalStateException("Walker " + walker.getId() + " is on edge " + here.getId());
        }

        @Override
        public Phase phase() {
            return phase;
        }

        @Override
        public NodeId actingRoot() {
            return walker.getActingRoot();
        }

        @Override
        public GraphStore graph() {
            return graphStore;
        }

        @Override
        public Object field(String name) {
            return walker.getField(name);
        }

        @Override
        public <T> T field(String name, Class<T> type) {
            return type.cast(walker.getField(name));
        }

        @Override
        public void setField(String name, Object value) {
            walker.setField(name, value);
        }

        @Override
        public boolean visit(TraversalPath path) {
            return visit(path, -1);
        }

        @Override
        public boolean visit(TraversalPath path, int index) {
            GraphElement origin = graphStore.find(here.getId()).orElse(here);
            List<ElementId> targets = visitResolver.resolve(origin, path, walker.getActingRoot());
            return enqueue(walker, targets, index, visitFrame);
        }

        @Override
        public boolean visit(Collection<? extends ElementId> targets) {
            return visit(targets, -1);
        }

        @Override
        public boolean visit(Collection<? extends ElementId> targets, int index) {
            return enqueue(walker, visitResolver.expand(targets), index, visitFrame);
        }

        @Override
        public boolean visit(ElementId target) {
            return visit(List.of(target), -1);
        }

        @Override
        public void ignore(Collection<? extends ElementId> elements) {
            elements.forEach(walker::ignore);
        }

        @Override
        public void report(Object value) {
            walker.report(value);
        }

        @Override
        public List<Object> reports() {
            return walker.getReports();
        }

        @Override
        public void disengage() {
            walker.disengage();
        }

        @Override
        public Object global(String name) {
            if (!options.getGlobals().containsKey(name)) {
                throw new IllegalArgumentException("Unknown global '" + name + "'");
            }
            return options.getGlobals().get(name);
        }

        @Override
        public <T> FlowHandle<T> flow(Callable<T> task) {
            return flowExecutor.launch(task);
        }

        @Override
        public <T> T await(FlowHandle<T> handle) {
            return flowExecutor.await(handle);
        }

        @Override
        public <T> T await(FlowHandle<T> handle, Duration timeout) {
            return flowExecutor.await(handle, timeout);
        }
    }
}
