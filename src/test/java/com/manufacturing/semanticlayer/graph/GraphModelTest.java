package com.manufacturing.semanticlayer.graph;

import com.manufacturing.semanticlayer.exception.DuplicateEdgeException;
import com.manufacturing.semanticlayer.exception.DuplicateNodeException;
import com.manufacturing.semanticlayer.exception.UnknownNodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphModelTest {

    private GraphModel graph;

    @BeforeEach
    void setUp() {
        graph = GraphModel.directed("schema");
        for (String table : List.of("product", "equipment", "order", "customer")) {
            graph.addNode(GraphNode.table(table, "fact", null));
        }
        graph.addEdge(relates("equipment", "product", "produces"));
        graph.addEdge(relates("product", "order", "ordered_in"));
    }

    @Test
    void testAddDuplicateNodeFails() {
        DuplicateNodeException e = assertThrows(DuplicateNodeException.class,
                () -> graph.addNode(GraphNode.table("product", "dimension", null)));
        assertTrue(e.getMessage().contains("product"));
    }

    @Test
    void testAddEdgeToUnknownNodeFails() {
        UnknownNodeException e = assertThrows(UnknownNodeException.class,
                () -> graph.addEdge(relates("order", "invoice", "billed_as")));
        assertEquals("invoice", e.getNodeId());
    }

    @Test
    void testDuplicateOrderedEdgeFails() {
        assertThrows(DuplicateEdgeException.class, () -> graph.addEdge(relates("equipment", "product", "again")));
    }

    @Test
    void testReverseEdgeAllowedWhenDirected() {
        graph.addEdge(relates("product", "equipment", "maintained_by"));

        assertEquals(3, graph.edgeCount());
        assertEquals("produces", graph.getEdge("equipment", "product").orElseThrow().getRelationshipKind());
        assertEquals("maintained_by", graph.getEdge("product", "equipment").orElseThrow().getRelationshipKind());
    }

    @Test
    void testReverseEdgeIsDuplicateWhenUndirected() {
        GraphModel undirected = GraphModel.undirected("schema");
        undirected.addNode(GraphNode.table("a", null, null));
        undirected.addNode(GraphNode.table("b", null, null));
        undirected.addEdge(relates("a", "b", "x"));

        assertThrows(DuplicateEdgeException.class, () -> undirected.addEdge(relates("b", "a", "y")));
    }

    @Test
    void testNeighborsAreSortedAndIgnoreDirection() {
        assertEquals(List.of("equipment", "order"), graph.neighbors("product"));
        assertEquals(List.of("product"), graph.neighbors("equipment"));
        assertEquals(List.of(), graph.neighbors("customer"));
    }

    @Test
    void testNeighborsOfUnknownNodeFails() {
        assertThrows(UnknownNodeException.class, () -> graph.neighbors("warehouse"));
    }

    @Test
    void testGetEdgeKeepsOwnDirection() {
        GraphEdge edge = graph.getEdge("product", "equipment").orElseThrow();

        assertEquals("equipment", edge.getFrom());
        assertEquals("product", edge.getTo());
        assertEquals("product", edge.opposite("equipment"));
        assertTrue(graph.getEdge("equipment", "customer").isEmpty());
    }

    @Test
    void testEdgesAreOrderedBySourceThenTarget() {
        graph.addEdge(relates("customer", "order", "places"));

        List<GraphEdge> edges = graph.edges();

        assertEquals("customer", edges.get(0).getFrom());
        assertEquals("equipment", edges.get(1).getFrom());
        assertEquals("product", edges.get(2).getFrom());
    }

    @Test
    void testSealedGraphRejectsMutation() {
        graph.seal();

        assertTrue(graph.isSealed());
        assertThrows(IllegalStateException.class, () -> graph.addNode(GraphNode.table("invoice", null, null)));
        assertThrows(IllegalStateException.class, () -> graph.addEdge(relates("order", "customer", "placed_by")));
    }

    @Test
    void testSummary() {
        GraphSummary summary = graph.summary();

        assertEquals(4, summary.getNodeCount());
        assertEquals(2, summary.getEdgeCount());
        assertEquals(4L, summary.getNodesByKind().get(NodeKind.TABLE));
        assertEquals(2L, summary.getEdgesByType().get(EdgeType.RELATES_TO));
        assertFalse(summary.isConnected());

        graph.addEdge(relates("order", "customer", "placed_by"));
        assertTrue(graph.summary().isConnected());
    }

    @Test
    void testSemanticNodeIdsAreNamespaced() {
        GraphNode intent = GraphNode.intent(1L, "quality-review", null);
        GraphNode concept = GraphNode.concept(1L, "quality-review", null);
        GraphNode field = GraphNode.field("product_defects", "severity");

        assertEquals("intent:quality-review", intent.getId());
        assertEquals("concept:quality-review", concept.getId());
        assertEquals("field:product_defects.severity", field.getId());
        assertEquals("product_defects", field.getTableName());
        assertEquals("severity", field.getColumnName());
    }

    private static GraphEdge relates(String from, String to, String kind) {
        return GraphEdge.builder()
                .from(from)
                .to(to)
                .type(EdgeType.RELATES_TO)
                .relationshipKind(kind)
                .joinColumn(to + "_id")
                .weight(1.0)
                .build();
    }
}
