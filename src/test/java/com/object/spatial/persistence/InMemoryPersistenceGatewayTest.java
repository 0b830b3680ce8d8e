package com.object.spatial.persistence;

import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPersistenceGatewayTest {

    private static Node node(long id, String name) {
        return Node.builder()
                .id(new NodeId(id))
                .type(Archetype.ROOT)
                .rootId(new NodeId(id))
                .attributes(Map.of("name", name))
                .persistent(true)
                .build();
    }

    @Test
    @DisplayName("Should load a registered root by key")
    void testRegisterAndLoadRoot() {
        InMemoryPersistenceGateway gateway = new InMemoryPersistenceGateway();
        gateway.registerRoot("tenant", node(1, "root"));

        assertEquals(new NodeId(1), gateway.loadRoot("tenant").orElseThrow().getId());
        assertTrue(gateway.loadRoot("unknown").isEmpty());
    }

    @Test
    @DisplayName("Should keep the latest snapshot and count every save")
    void testSaveOverwrites() {
        InMemoryPersistenceGateway gateway = new InMemoryPersistenceGateway();
        gateway.save(node(1, "first"));
        gateway.save(node(1, "second"));

        assertEquals(1, gateway.size());
        assertEquals(2, gateway.getSaveCount());
        assertEquals("second", gateway.find(new NodeId(1)).orElseThrow().getAttribute("name"));
    }

    @Test
    @DisplayName("Should forget removed elements")
    void testRemove() {
        InMemoryPersistenceGateway gateway = new InMemoryPersistenceGateway();
        gateway.registerRoot("tenant", node(1, "root"));
        gateway.remove(new NodeId(1));

        assertFalse(gateway.contains(new NodeId(1)));
        assertTrue(gateway.loadRoot("tenant").isEmpty());
        assertDoesNotThrow(() -> gateway.remove(new NodeId(99)));
    }

    @Test
    @DisplayName("Should reserve id blocks above every saved id")
    void testReserveIds() {
        InMemoryPersistenceGateway gateway = new InMemoryPersistenceGateway();
        gateway.save(node(40, "loaded"));

        long first = gateway.reserveIds(10);
        long second = gateway.reserveIds(10);

        assertEquals(41, first);
        assertEquals(51, second);
        assertThrows(IllegalArgumentException.class, () -> gateway.reserveIds(0));
    }

    @Test
    @DisplayName("NoOp gateway should never find a root")
    void testNoOp() {
        NoOpPersistenceGateway gateway = new NoOpPersistenceGateway();
        gateway.save(node(1, "root"));
        assertTrue(gateway.loadRoot("tenant").isEmpty());
        assertEquals(1, gateway.reserveIds(8));
        assertEquals(9, gateway.reserveIds(8));
    }
}
