package com.object.spatial.visit;

import com.object.spatial.core.model.AccessLevel;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Direction;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.EdgeDirection;
import com.object.spatial.core.model.EdgeId;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.error.FilterEvaluationException;
import com.object.spatial.graph.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VisitResolverTest {

    private static final Archetype PLACE = Archetype.node("Place").build();
    private static final Archetype CITY = Archetype.node("City").parent(PLACE).build();
    private static final Archetype VILLAGE = Archetype.node("Village").parent(PLACE).build();
    private static final Archetype ROAD = Archetype.edge("Road").build();
    private static final Archetype TRAIL = Archetype.edge("Trail").build();

    private InMemoryGraphStore store;
    private VisitResolver resolver;
    private NodeId root;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        resolver = new VisitResolver(store);
        root = store.root("main").getId();
    }

    private Node place(Archetype type, String name, int population) {
        return store.createNode(root, type, Map.of("name", name, "population", population));
    }

    private Edge link(Archetype type, Node from, Node to) {
        return store.createEdge(type, from.getId(), to.getId(), Map.of(), EdgeDirection.DIRECTED);
    }

    @Nested
    @DisplayName("Single hop")
    class SingleHopTests {

        private Node hub;
        private Node paris;
        private Node lyon;
        private Node hamlet;

        @BeforeEach
        void setUpGraph() {
            hub = place(CITY, "Hub", 1);
            paris = place(CITY, "Paris", 2_000_000);
            hamlet = place(VILLAGE, "Hamlet", 40);
            lyon = place(CITY, "Lyon", 500_000);
            link(ROAD, hub, paris);
            link(TRAIL, hub, hamlet);
            link(ROAD, hub, lyon);
        }

        @Test
        @DisplayName("Should return all outgoing neighbors in edge-creation order")
        void testAllOutgoing() {
            List<ElementId> ids = resolver.resolve(hub, TraversalPath.outgoing(), root);
            assertEquals(List.of(paris.getId(), hamlet.getId(), lyon.getId()), ids);
        }

        @Test
        @DisplayName("Should filter by node type including subtypes")
        void testNodeType() {
            assertEquals(List.of(paris.getId(), lyon.getId()),
                    resolver.resolve(hub, TraversalPath.out().nodeType(CITY).build(), root));
            assertEquals(3, resolver.resolve(hub, TraversalPath.out().nodeType(PLACE).build(), root).size());
        }

        @Test
        @DisplayName("Should filter by edge type")
        void testEdgeType() {
            assertEquals(List.of(hamlet.getId()),
                    resolver.resolve(hub, TraversalPath.out().edgeType(TRAIL).build(), root));
        }

        @Test
        @DisplayName("Should apply node predicates")
        void testNodePredicate() {
            TraversalPath big = TraversalPath.out()
                    .nodeWhere(n -> ((Integer) n.getAttribute("population")) > 100_000)
                    .nodeWhere(n -> !"Lyon".equals(n.getAttribute("name")))
                    .build();
            assertEquals(List.of(paris.getId()), resolver.resolve(hub, big, root));
        }

        @Test
        @DisplayName("Should match attribute equality")
        void testNodeAttribute() {
            assertEquals(List.of(lyon.getId()),
                    resolver.resolve(hub, TraversalPath.out().nodeAttribute("name", "Lyon").build(), root));
        }

        @Test
        @DisplayName("Should return an empty list when nothing matches")
        void testNoMatch() {
            assertTrue(resolver.resolve(paris, TraversalPath.outgoing(), root).isEmpty());
        }

        @Test
        @DisplayName("Should follow incoming edges")
        void testIncoming() {
            assertEquals(List.of(hub.getId()), resolver.resolve(lyon, TraversalPath.incoming(), root));
        }

        @Test
        @DisplayName("Should yield each edge ahead of its far node")
        void testIncludeEdges() {
            List<ElementId> ids = resolver.resolve(hub, TraversalPath.out().edgeType(ROAD).includeEdges().build(), root);

            assertEquals(4, ids.size());
            assertTrue(ids.get(0) instanceof EdgeId);
            assertEquals(paris.getId(), ids.get(1));
            assertTrue(ids.get(2) instanceof EdgeId);
            assertEquals(lyon.getId(), ids.get(3));
        }

        @Test
        @DisplayName("Should start from the target when here is an edge")
        void testFromEdge() {
            Node suburb = place(VILLAGE, "Suburb", 10);
            Edge edge = link(ROAD, paris, suburb);
            Edge back = store.getEdge(store.neighbors(hub.getId(), Direction.OUT, null).get(0).edge().getId());

            assertEquals(List.of(suburb.getId()), resolver.resolve(back, TraversalPath.outgoing(), root));
            assertTrue(resolver.resolve(edge, TraversalPath.outgoing(), root).isEmpty());
        }

        @Test
        @DisplayName("Should wrap predicate failures")
        void testPredicateFailure() {
            TraversalPath broken = TraversalPath.out()
                    .nodeWhere(n -> { throw new IllegalStateException("bad filter"); })
                    .build();

            FilterEvaluationException e = assertThrows(FilterEvaluationException.class,
                    () -> resolver.resolve(hub, broken, root));
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Nested
    @DisplayName("Multiple hops")
    class MultiHopTests {

        @Test
        @DisplayName("Should chain hops and deduplicate reached nodes")
        void testTwoHops() {
            Node a = place(CITY, "A", 1);
            Node b = place(CITY, "B", 1);
            Node c = place(CITY, "C", 1);
            Node d = place(CITY, "D", 1);
            link(ROAD, a, b);
            link(ROAD, a, c);
            link(ROAD, b, d);
            link(ROAD, c, d);

            TraversalPath twoHops = TraversalPath.out().then(Direction.OUT).build();

            assertEquals(List.of(d.getId()), resolver.resolve(a, twoHops, root));
        }

        @Test
        @DisplayName("Should keep each hop's filters separate")
        void testHopFilters() {
            Node a = place(CITY, "A", 1);
            Node b = place(VILLAGE, "B", 1);
            Node c = place(CITY, "C", 1);
            link(TRAIL, a, b);
            link(ROAD, b, c);

            TraversalPath path = TraversalPath.out().edgeType(TRAIL)
                    .then(Direction.OUT).edgeType(ROAD).nodeType(CITY)
                    .build();

            assertEquals(2, path.getHops().size());
            assertEquals(List.of(c.getId()), resolver.resolve(a, path, root));
        }
    }

    @Nested
    @DisplayName("Access")
    class AccessTests {

        @Test
        @DisplayName("Should drop candidates the acting root cannot read")
        void testUnreadablePartition() {
            NodeId other = store.root("other").getId();
            store.grant(other, root, AccessLevel.CONNECT);
            Node local = place(CITY, "Local", 1);
            Node foreign = store.createNode(other, CITY, Map.of("name", "Foreign"));
            link(ROAD, local, foreign);

            assertEquals(List.of(foreign.getId()), resolver.resolve(local, TraversalPath.outgoing(), root));

            NodeId stranger = store.root("stranger").getId();
            store.grant(root, stranger, AccessLevel.READ);
            assertTrue(resolver.resolve(local, TraversalPath.outgoing(), stranger).isEmpty());
        }
    }

    @Nested
    @DisplayName("Expand")
    class ExpandTests {

        @Test
        @DisplayName("Should expand edges to edge then target and drop unknown ids")
        void testExpand() {
            Node a = place(CITY, "A", 1);
            Node b = place(CITY, "B", 1);
            Edge edge = link(ROAD, a, b);
            Node gone = place(CITY, "Gone", 1);
            store.delete(gone.getId());

            List<ElementId> expanded = resolver.expand(List.of(a.getId(), edge.getId(), gone.getId()));

            assertEquals(List.of(a.getId(), edge.getId(), b.getId()), expanded);
        }
    }
}
