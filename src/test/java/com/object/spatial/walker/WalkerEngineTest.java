package com.object.spatial.walker;

import com.object.spatial.ability.ElementAbilityRegistry;
import com.object.spatial.api.RuntimeOptions;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.EdgeDirection;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.FieldSpec;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.core.model.Phase;
import com.object.spatial.error.FlowTaskException;
import com.object.spatial.error.WalkerExecutionException;
import com.object.spatial.flow.FlowExecutor;
import com.object.spatial.flow.FlowHandle;
import com.object.spatial.graph.InMemoryGraphStore;
import com.object.spatial.metrics.MetricsService;
import com.object.spatial.metrics.NoOpMetricsService;
import com.object.spatial.visit.TraversalPath;
import com.object.spatial.visit.VisitResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WalkerEngineTest {

    private static final Archetype CITY = Archetype.node("City").build();
    private static final Archetype ROAD = Archetype.edge("Road").build();
    private static final Archetype VISITOR = Archetype.walker("Visitor").build();

    private InMemoryGraphStore store;
    private VisitResolver resolver;
    private FlowExecutor flowExecutor;
    private NodeId root;
    private List<String> trace;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        resolver = new VisitResolver(store);
        flowExecutor = new FlowExecutor(2, 5_000);
        root = store.root("main").getId();
        trace = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        flowExecutor.close();
    }

    private WalkerEngine engine(RuntimeOptions options) {
        return new WalkerEngine(store, resolver, flowExecutor, new NoOpMetricsService(), options);
    }

    private WalkerEngine engine() {
        return engine(RuntimeOptions.defaults());
    }

    private WalkerEngine engine(ElementAbilityRegistry elementAbilities) {
        return new WalkerEngine(store, resolver, flowExecutor, new NoOpMetricsService(),
                RuntimeOptions.defaults(), elementAbilities);
    }

    private Walker walker(WalkerType type) {
        return new Walker("w-1", type, root, Map.of());
    }

    private Node city(String name) {
        return store.createNode(root, CITY, Map.of("name", name));
    }

    private Edge road(Node from, Node to) {
        return store.createEdge(ROAD, from.getId(), to.getId(), Map.of(), EdgeDirection.DIRECTED);
    }

    private static String name(GraphElement element) {
        return element.isNode() ? (String) element.getAttribute("name") : "edge";
    }

    /**
     * Walker that traces every entry and exit and follows outgoing edges at {@code index}.
     */
    private WalkerType tracing(int index) {
        return WalkerType.builder("Tracer")
                .onEntryAny(ctx -> {
                    trace.add("in " + name(ctx.here()));
                    ctx.visit(TraversalPath.outgoing(), index);
                })
                .onExitAny(ctx -> trace.add("out " + name(ctx.here())))
                .build();
    }

    @Nested
    @DisplayName("Traversal order")
    class OrderTests {

        @Test
        @DisplayName("Should run children's exits before the parent's exit")
        void testExitsAfterChildren() {
            Node a = city("A");
            road(a, city("B"));
            road(a, city("C"));

            WalkerOutcome outcome = engine().run(walker(tracing(-1)), List.of(a.getId()));

            assertEquals(WalkerOutcome.COMPLETED, outcome);
            assertEquals(List.of("in A", "in B", "in C", "out B", "out C", "out A"), trace);
        }

        @Test
        @DisplayName("Should unwind a chain in reverse entry order")
        void testChainUnwind() {
            Node first = city("1");
            Node previous = first;
            for (int i = 2; i <= 4; i++) {
                Node next = city(String.valueOf(i));
                road(previous, next);
                previous = next;
            }

            engine().run(walker(tracing(0)), List.of(first.getId()));

            assertEquals(List.of("in 1", "in 2", "in 3", "in 4", "out 4", "out 3", "out 2", "out 1"), trace);
        }

        @Test
        @DisplayName("Should go depth-first when visits are prepended")
        void testDepthFirst() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            road(a, city("C"));
            road(b, city("D"));

            engine().run(walker(tracing(0)), List.of(a.getId()));

            assertEquals(List.of("in A", "in B", "in D", "out D", "out B", "in C", "out C", "out A"), trace);
        }

        @Test
        @DisplayName("Should go breadth-first when visits are appended")
        void testBreadthFirst() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            road(a, city("C"));
            road(b, city("D"));

            Walker walker = walker(tracing(-1));
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of("in A", "in B", "in C", "in D", "out D", "out B", "out C", "out A"), trace);
            assertEquals(4, walker.getPath().size());
        }

        @Test
        @DisplayName("Should insert at negative positions counted from the tail")
        void testNegativeIndex() {
            Node a = city("A");
            Node b = city("B");
            Node c = city("C");
            Node d = city("D");
            WalkerType type = WalkerType.builder("Inserter")
                    .onEntry(CITY, ctx -> {
                        trace.add("in " + name(ctx.here()));
                        if (ctx.here().getId().equals(a.getId())) {
                            ctx.visit(List.of(b.getId(), c.getId()));
                            ctx.visit(List.of(d.getId()), -2);
                        }
                    })
                    .build();

            engine().run(walker(type), List.of(a.getId()));

            assertEquals(List.of("in A", "in B", "in D", "in C"), trace);
        }

        @Test
        @DisplayName("Should enter an edge ahead of its target")
        void testEdgeVisit() {
            Node a = city("A");
            Node b = city("B");
            Edge edge = road(a, b);
            WalkerType type = WalkerType.builder("EdgeWalker")
                    .onEntryAny(ctx -> {
                        trace.add("in " + name(ctx.here()));
                        if (ctx.here().isNode()) {
                            ctx.visit(TraversalPath.out().includeEdges().build());
                        }
                    })
                    .onExit(ROAD, ctx -> trace.add("out edge"))
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of(a.getId(), edge.getId(), b.getId()), walker.getPath());
            assertEquals(List.of("in A", "in edge", "in B", "out edge"), trace);
        }

        @Test
        @DisplayName("Should follow visits issued during exits")
        void testVisitFromExit() {
            Node a = city("A");
            Node late = city("Late");
            WalkerType type = WalkerType.builder("Returner")
                    .onEntryAny(ctx -> trace.add("in " + name(ctx.here())))
                    .onExitAny(ctx -> {
                        trace.add("out " + name(ctx.here()));
                        if (ctx.here().getId().equals(a.getId())) {
                            ctx.visit(late.getId());
                        }
                    })
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of("in A", "out A", "in Late", "out Late"), trace);
            assertEquals(List.of(a.getId(), late.getId()), walker.getPath());
        }
    }

    @Nested
    @DisplayName("Exit policy")
    class ExitPolicyTests {

        private WalkerType counting() {
            return WalkerType.builder("Counter")
                    .onEntryAny(ctx -> trace.add("in"))
                    .onExitAny(ctx -> trace.add("out"))
                    .build();
        }

        @Test
        @DisplayName("Should exit a node once per run by default")
        void testOncePerNode() {
            Node a = city("A");

            engine().run(walker(counting()), List.of(a.getId(), a.getId()));

            assertEquals(List.of("in", "in", "out"), trace);
        }

        @Test
        @DisplayName("Should exit on every visit when configured")
        void testOncePerVisit() {
            Node a = city("A");
            RuntimeOptions options = RuntimeOptions.builder().exitPolicy(ExitPolicy.ONCE_PER_VISIT).build();

            engine(options).run(walker(counting()), List.of(a.getId(), a.getId()));

            assertEquals(List.of("in", "in", "out", "out"), trace);
        }
    }

    @Nested
    @DisplayName("Reports and state")
    class ReportTests {

        @Test
        @DisplayName("Should keep reports in emission order including duplicates")
        void testReportOrder() {
            Node a = city("A");
            road(a, city("B"));
            WalkerType type = WalkerType.builder("Reporter")
                    .onEntryAny(ctx -> {
                        ctx.report("A".equals(name(ctx.here())) ? 1 : 2);
                        ctx.visit(TraversalPath.outgoing());
                    })
                    .onExitAny(ctx -> {
                        if ("A".equals(name(ctx.here()))) {
                            ctx.report(1);
                        }
                    })
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of(1, 2, 1), walker.getReports());
        }

        @Test
        @DisplayName("Should read and write declared fields")
        void testFields() {
            Node a = city("A");
            road(a, city("B"));
            WalkerType type = WalkerType.builder("Counter")
                    .field(FieldSpec.optional("count", 0))
                    .onEntryAny(ctx -> {
                        ctx.setField("count", ctx.field("count", Integer.class) + 1);
                        ctx.visit(TraversalPath.outgoing());
                    })
                    .build();

            Walker walker = new Walker("w-1", type, root, Map.of("count", 0));
            engine().run(walker, List.of(a.getId()));

            assertEquals(2, walker.getField("count"));
            assertThrows(IllegalArgumentException.class, () -> walker.setField("undeclared", 1));
        }

        @Test
        @DisplayName("Should expose runtime globals")
        void testGlobals() {
            Node a = city("A");
            RuntimeOptions options = RuntimeOptions.builder().global("greeting", "hello").build();
            WalkerType type = WalkerType.builder("Greeter")
                    .onEntryAny(ctx -> ctx.report(ctx.global("greeting")))
                    .build();

            Walker walker = walker(type);
            engine(options).run(walker, List.of(a.getId()));

            assertEquals(List.of("hello"), walker.getReports());
        }

        @Test
        @DisplayName("Should finish in DONE with nothing queued")
        void testFinalState() {
            Node a = city("A");
            road(a, city("B"));
            Walker walker = walker(tracing(-1));

            engine().run(walker, List.of(a.getId()));

            assertEquals(WalkerState.DONE, walker.getState());
            assertEquals(WalkerOutcome.COMPLETED, walker.getOutcome());
            assertEquals(0, walker.getQueueSize());
            assertEquals(0, walker.getPendingExitDepth());
        }

        @Test
        @DisplayName("Should refuse to run a walker twice")
        void testSingleUse() {
            Node a = city("A");
            Walker walker = walker(tracing(-1));
            engine().run(walker, List.of(a.getId()));

            assertThrows(IllegalStateException.class, () -> engine().run(walker, List.of(a.getId())));
        }

        @Test
        @DisplayName("Should expose path and queued targets as live references")
        void testLiveReferences() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            List<ElementId> seen = new ArrayList<>();
            WalkerType type = WalkerType.builder("Observer")
                    .onEntryAny(ctx -> {
                        ctx.visit(TraversalPath.outgoing());
                        if (ctx.here().getId().equals(a.getId())) {
                            seen.addAll(ctx.walker().liveReferences());
                        }
                    })
                    .build();

            engine().run(walker(type), List.of(a.getId()));

            assertEquals(List.of(a.getId(), b.getId()), seen);
        }
    }

    @Nested
    @DisplayName("Disengage")
    class DisengageTests {

        @Test
        @DisplayName("Should stop immediately and skip pending exits")
        void testDisengageFirstTarget() {
            List<NodeId> seeds = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                seeds.add(city("N" + i).getId());
            }
            WalkerType type = WalkerType.builder("Quitter")
                    .onEntryAny(ctx -> {
                        ctx.report("entered");
                        ctx.disengage();
                    })
                    .onEntryAny(ctx -> trace.add("second handler"))
                    .onExitAny(ctx -> trace.add("out"))
                    .build();

            Walker walker = walker(type);
            WalkerOutcome outcome = engine().run(walker, new ArrayList<>(seeds));

            assertEquals(WalkerOutcome.DISENGAGED, outcome);
            assertTrue(walker.isDisengaged());
            assertEquals(1, walker.getPath().size());
            assertEquals(List.of("entered"), walker.getReports());
            assertTrue(trace.isEmpty());
            assertEquals(0, walker.getQueueSize());
        }

        @Test
        @DisplayName("Should stop during exits")
        void testDisengageDuringExit() {
            Node a = city("A");
            road(a, city("B"));
            road(a, city("C"));
            WalkerType type = WalkerType.builder("ExitQuitter")
                    .onEntryAny(ctx -> ctx.visit(TraversalPath.outgoing()))
                    .onExitAny(ctx -> {
                        trace.add("out " + name(ctx.here()));
                        ctx.disengage();
                    })
                    .build();

            assertEquals(WalkerOutcome.DISENGAGED, engine().run(walker(type), List.of(a.getId())));
            assertEquals(List.of("out B"), trace);
        }
    }

    @Nested
    @DisplayName("Skipped targets")
    class SkipTests {

        @Test
        @DisplayName("Should not enqueue ignored elements")
        void testIgnoreBeforeVisit() {
            Node a = city("A");
            Node b = city("B");
            Node c = city("C");
            road(a, b);
            road(a, c);
            WalkerType type = WalkerType.builder("Picky")
                    .onEntryAny(ctx -> {
                        ctx.ignore(List.of(c.getId()));
                        ctx.visit(TraversalPath.outgoing());
                    })
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of(a.getId(), b.getId()), walker.getPath());
        }

        @Test
        @DisplayName("Should skip queued elements ignored later and still exit the parent")
        void testIgnoreAfterVisit() {
            Node a = city("A");
            Node b = city("B");
            Node c = city("C");
            road(a, b);
            road(a, c);
            WalkerType type = WalkerType.builder("Picky")
                    .onEntryAny(ctx -> {
                        trace.add("in " + name(ctx.here()));
                        ctx.visit(TraversalPath.outgoing());
                        ctx.ignore(List.of(c.getId()));
                    })
                    .onExitAny(ctx -> trace.add("out " + name(ctx.here())))
                    .build();

            engine().run(walker(type), List.of(a.getId()));

            assertEquals(List.of("in A", "in B", "out B", "out A"), trace);
        }

        @Test
        @DisplayName("Should skip targets deleted after they were queued")
        void testDeletedTarget() {
            Node a = city("A");
            Node b = city("B");
            Node c = city("C");
            road(a, b);
            road(a, c);
            WalkerType type = WalkerType.builder("Deleter")
                    .onEntryAny(ctx -> {
                        ctx.visit(TraversalPath.outgoing());
                        if (ctx.here().getId().equals(a.getId())) {
                            ctx.graph().delete(c.getId());
                        }
                    })
                    .build();

            Walker walker = walker(type);
            assertEquals(WalkerOutcome.COMPLETED, engine().run(walker, List.of(a.getId())));
            assertEquals(List.of(a.getId(), b.getId()), walker.getPath());
        }
    }

    @Nested
    @DisplayName("Deleted while entered")
    class DeletedExitTests {

        @Test
        @DisplayName("Should not run exits for an element deleted after it was entered")
        void testExitSkippedForDeleted() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            WalkerType type = WalkerType.builder("Demolisher")
                    .onEntryAny(ctx -> {
                        trace.add("in " + name(ctx.here()));
                        if (ctx.here().getId().equals(b.getId())) {
                            ctx.graph().delete(a.getId());
                        }
                        ctx.visit(TraversalPath.outgoing());
                    })
                    .onExitAny(ctx -> trace.add("out " + name(ctx.here())))
                    .build();

            assertEquals(WalkerOutcome.COMPLETED, engine().run(walker(type), List.of(a.getId())));
            assertEquals(List.of("in A", "in B", "out B"), trace);
        }
    }

    @Nested
    @DisplayName("Element abilities")
    class ElementAbilityTests {

        private ElementAbilityRegistry tracingCity(String prefix) {
            return new ElementAbilityRegistry()
                    .onEntry(CITY, ctx -> trace.add(prefix + " in any"))
                    .onEntry(CITY, VISITOR, ctx -> trace.add(prefix + " in visitor"))
                    .onExit(CITY, ctx -> trace.add(prefix + " out any"))
                    .onExit(CITY, VISITOR, ctx -> trace.add(prefix + " out visitor"));
        }

        @Test
        @DisplayName("Should run walker, any-walker and walker-typed handlers in order, exits reversed")
        void testDispatchOrder() {
            Node a = city("A");
            WalkerType inspector = WalkerType.builder("Inspector")
                    .parent(VISITOR)
                    .onEntry(CITY, ctx -> trace.add("walker in"))
                    .onExit(CITY, ctx -> trace.add("walker out"))
                    .build();

            engine(tracingCity("city")).run(walker(inspector), List.of(a.getId()));

            assertEquals(List.of("walker in", "city in any", "city in visitor",
                    "city out visitor", "city out any", "walker out"), trace);
        }

        @Test
        @DisplayName("Should skip walker-typed handlers for other walker types")
        void testOtherWalkerType() {
            Node a = city("A");
            WalkerType stranger = WalkerType.builder("Stranger").build();

            engine(tracingCity("city")).run(walker(stranger), List.of(a.getId()));

            assertEquals(List.of("city in any", "city out any"), trace);
        }

        @Test
        @DisplayName("Should let an element ability steer the walker")
        void testElementSteers() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            ElementAbilityRegistry registry = new ElementAbilityRegistry()
                    .onEntry(CITY, ctx -> ctx.visit(TraversalPath.outgoing()));

            Walker walker = walker(WalkerType.builder("Passive").build());
            engine(registry).run(walker, List.of(a.getId()));

            assertEquals(List.of(a.getId(), b.getId()), walker.getPath());
        }

        @Test
        @DisplayName("Should stop the remaining handlers when an element ability disengages")
        void testElementDisengage() {
            Node a = city("A");
            ElementAbilityRegistry registry = new ElementAbilityRegistry()
                    .onEntry(CITY, ctx -> ctx.disengage())
                    .onEntry(CITY, VISITOR, ctx -> trace.add("typed"));
            WalkerType inspector = WalkerType.builder("Inspector").parent(VISITOR).build();

            assertEquals(WalkerOutcome.DISENGAGED, engine(registry).run(walker(inspector), List.of(a.getId())));
            assertTrue(trace.isEmpty());
        }
    }

    @Nested
    @DisplayName("Spawn and finish abilities")
    class SpawnFinishTests {

        private WalkerType.Builder tour() {
            return WalkerType.builder("Tour")
                    .onSpawn(ctx -> trace.add("spawn " + name(ctx.here())))
                    .onFinish(ctx -> trace.add("finish " + name(ctx.here())))
                    .onExitAny(ctx -> trace.add("out " + name(ctx.here())));
        }

        @Test
        @DisplayName("Should run once around the traversal on the spawn location and the last element")
        void testAroundTraversal() {
            Node a = city("A");
            road(a, city("B"));
            WalkerType type = tour()
                    .onEntryAny(ctx -> {
                        trace.add("in " + name(ctx.here()));
                        ctx.visit(TraversalPath.outgoing());
                    })
                    .build();

            assertEquals(WalkerOutcome.COMPLETED, engine().run(walker(type), List.of(a.getId())));
            assertEquals(List.of("spawn A", "in A", "in B", "out B", "out A", "finish B"), trace);
        }

        @Test
        @DisplayName("Should skip the finish abilities when the walker disengages")
        void testFinishSkippedOnDisengage() {
            Node a = city("A");
            WalkerType type = tour()
                    .onEntryAny(ctx -> {
                        trace.add("in " + name(ctx.here()));
                        ctx.disengage();
                    })
                    .build();

            assertEquals(WalkerOutcome.DISENGAGED, engine().run(walker(type), List.of(a.getId())));
            assertEquals(List.of("spawn A", "in A"), trace);
        }

        @Test
        @DisplayName("Should follow visits issued at spawn after the spawn targets")
        void testSpawnVisits() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            WalkerType type = WalkerType.builder("Launcher")
                    .onSpawn(ctx -> ctx.visit(TraversalPath.outgoing()))
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of(a.getId(), b.getId()), walker.getPath());
        }

        @Test
        @DisplayName("Should enter nothing when a spawn ability disengages")
        void testSpawnDisengage() {
            Node a = city("A");
            WalkerType type = tour().onSpawn(ctx -> ctx.disengage()).build();

            Walker walker = walker(type);
            assertEquals(WalkerOutcome.DISENGAGED, engine().run(walker, List.of(a.getId())));
            assertTrue(walker.getPath().isEmpty());
            assertEquals(List.of("spawn A"), trace);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should finish the walker as failed when an ability throws an Error")
        void testErrorFinishesWalker() {
            Node a = city("A");
            road(a, city("B"));
            WalkerType type = WalkerType.builder("Recursive")
                    .onEntryAny(ctx -> {
                        ctx.visit(TraversalPath.outgoing());
                        if (!ctx.here().getId().equals(a.getId())) {
                            throw new StackOverflowError("ability recursed too deep");
                        }
                    })
                    .build();

            Walker walker = walker(type);
            assertThrows(StackOverflowError.class, () -> engine().run(walker, List.of(a.getId())));

            assertEquals(WalkerState.DONE, walker.getState());
            assertEquals(WalkerOutcome.FAILED, walker.getOutcome());
            assertEquals(0, walker.getQueueSize());
            assertEquals(0, walker.getPendingExitDepth());
        }

        @Test
        @DisplayName("Should wrap ability failures with the reports and path so far")
        void testAbilityFailure() {
            Node a = city("A");
            Node b = city("B");
            road(a, b);
            WalkerType type = WalkerType.builder("Fragile")
                    .onEntryAny(ctx -> {
                        if (ctx.here().getId().equals(b.getId())) {
                            throw new IllegalStateException("broken at B");
                        }
                        ctx.report("A ok");
                        ctx.visit(TraversalPath.outgoing());
                    })
                    .build();

            Walker walker = walker(type);
            WalkerExecutionException e = assertThrows(WalkerExecutionException.class,
                    () -> engine().run(walker, List.of(a.getId())));

            assertEquals("w-1", e.getWalkerId());
            assertEquals(List.of("A ok"), e.getReports());
            assertEquals(List.of(a.getId(), b.getId()), e.getPath());
            assertTrue(e.getCause() instanceof IllegalStateException);
            assertEquals(WalkerOutcome.FAILED, walker.getOutcome());
            assertEquals(WalkerState.DONE, walker.getState());
        }

        @Test
        @DisplayName("Should wrap checked exceptions")
        void testCheckedFailure() {
            Node a = city("A");
            WalkerType type = WalkerType.builder("Io")
                    .onEntryAny(ctx -> {
                        throw new IOException("disk gone");
                    })
                    .build();

            WalkerExecutionException e = assertThrows(WalkerExecutionException.class,
                    () -> engine().run(walker(type), List.of(a.getId())));
            assertTrue(e.getCause() instanceof IOException);
        }

        @Test
        @DisplayName("Should fail on unknown globals")
        void testUnknownGlobal() {
            Node a = city("A");
            WalkerType type = WalkerType.builder("Lost")
                    .onEntryAny(ctx -> ctx.global("missing"))
                    .build();

            WalkerExecutionException e = assertThrows(WalkerExecutionException.class,
                    () -> engine().run(walker(type), List.of(a.getId())));
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Nested
    @DisplayName("Flow tasks")
    class FlowTests {

        @Test
        @DisplayName("Should join flow results inside an ability")
        void testFlowAwait() {
            Node a = city("A");
            WalkerType type = WalkerType.builder("Parallel")
                    .onEntryAny(ctx -> {
                        FlowHandle<Integer> left = ctx.flow(() -> 20);
                        FlowHandle<Integer> right = ctx.flow(() -> 22);
                        ctx.report(ctx.await(left) + ctx.await(right));
                    })
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of(42), walker.getReports());
        }

        @Test
        @DisplayName("Should allow reports from flow tasks")
        void testReportFromFlow() {
            Node a = city("A");
            WalkerType type = WalkerType.builder("FlowReporter")
                    .onEntryAny(ctx -> ctx.await(ctx.flow(() -> {
                        ctx.report("from flow");
                        return null;
                    })))
                    .build();

            Walker walker = walker(type);
            engine().run(walker, List.of(a.getId()));

            assertEquals(List.of("from flow"), walker.getReports());
        }

        @Test
        @DisplayName("Should reject queue changes from a flow task")
        void testVisitFromFlowRejected() {
            Node a = city("A");
            Node b = city("B");
            WalkerType type = WalkerType.builder("Rogue")
                    .onEntryAny(ctx -> ctx.await(ctx.flow(() -> ctx.visit(b.getId()))))
                    .build();

            WalkerExecutionException e = assertThrows(WalkerExecutionException.class,
                    () -> engine().run(walker(type), List.of(a.getId())));

            assertTrue(e.getCause() instanceof FlowTaskException);
            assertTrue(e.getCause().getCause() instanceof IllegalStateException);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Should count each ability invocation")
        void testInvocationCount() {
            MetricsService metrics = mock(MetricsService.class);
            Node a = city("A");
            road(a, city("B"));

            new WalkerEngine(store, resolver, flowExecutor, metrics, RuntimeOptions.defaults())
                    .run(walker(tracing(-1)), List.of(a.getId()));

            verify(metrics, times(2)).incrementAbilityInvocation(Phase.ENTRY);
            verify(metrics, times(2)).incrementAbilityInvocation(Phase.EXIT);
        }

        @Test
        @DisplayName("Should invoke nothing for a walker without abilities")
        void testNoAbilities() {
            MetricsService metrics = mock(MetricsService.class);
            Node a = city("A");
            Node b = city("B");
            WalkerType bare = WalkerType.builder("Bare").build();

            Walker walker = walker(bare);
            WalkerOutcome outcome = new WalkerEngine(store, resolver, flowExecutor, metrics, RuntimeOptions.defaults())
                    .run(walker, List.of(a.getId(), b.getId()));

            assertEquals(WalkerOutcome.COMPLETED, outcome);
            assertEquals(List.of(a.getId(), b.getId()), walker.getPath());
            verify(metrics, never()).incrementAbilityInvocation(any());
        }
    }
}
