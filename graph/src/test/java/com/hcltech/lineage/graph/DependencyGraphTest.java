package com.hcltech.lineage.graph;

import com.hcltech.lineage.graph.exceptions.ConsistencyException;
import com.hcltech.lineage.graph.exceptions.DuplicateNodeException;
import com.hcltech.lineage.graph.exceptions.FormatException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hcltech.lineage.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void duplicateCanonicalId_isRejected() {
        var g = new DependencyGraph();
        g.addNode("A0", "A0");
        assertThrows(DuplicateNodeException.class, () -> g.addNode("A0", "B0"));
        assertEquals(1, g.size());
    }

    @Test
    void malformedDisplayName_isRejected() {
        var g = new DependencyGraph();
        assertThrows(FormatException.class, () -> g.addNode("n1", "not-a-name"));
        assertTrue(g.isEmpty());
    }

    @Test
    void canonicalIdWithAliasSeparator_isRejected() {
        var g = new DependencyGraph();
        g.addNode("A0", "A0");
        assertThrows(FormatException.class, () -> g.addNode("A0#1", "B0"));
        assertEquals(List.of("A0"), g.canonicalIds());
    }

    @Test
    void adjacencyViews_rejectTwoNodesWithTheSameCurrentName() {
        var g = new DependencyGraph();
        g.addNode("P", "a0");
        g.addNode("Q", "A0");
        g.addEdge("P", "Q");
        new TransformationEngine(ScriptedRandom.doubles(0.0)).transform(g, new KahnLayering().produceLayers(g));
        assertEquals("A1", g.node("P").displayName());
        assertEquals("A1", g.node("Q").displayName());

        var ex = assertThrows(ConsistencyException.class, g::successorsByName);
        assertTrue(ex.getMessage().contains("P") && ex.getMessage().contains("Q"), ex.getMessage());
        assertThrows(ConsistencyException.class, g::predecessorsByName);
    }

    @Test
    void canonicalIdAndDisplayNameAreIndependent() {
        var g = new DependencyGraph();
        GraphNode n = g.addNode("file:src/Main.java", "Main0");
        assertEquals("file:src/Main.java", n.canonicalId());
        assertEquals("Main0", n.displayName());
        assertEquals(0, n.transformCount());
        assertTrue(n.renameHistory().isEmpty());
        assertTrue(n.parentHistory().isEmpty());
    }

    @Test
    void selfLoop_isIgnored_andRepeatedEdgeCollapses() {
        var g = graph(List.of("A0", "B0"));
        assertFalse(g.addEdge("A0", "A0"));
        assertTrue(g.addEdge("A0", "B0"));
        assertFalse(g.addEdge("A0", "B0"));
        assertEquals(Set.of(new Edge("A0", "B0")), g.edges());
    }

    @Test
    void edgeToUnknownNode_isRejected() {
        var g = graph(List.of("A0"));
        assertThrows(IllegalArgumentException.class, () -> g.addEdge("A0", "Z9"));
        assertThrows(IllegalArgumentException.class, () -> g.addEdge("Z9", "A0"));
        assertTrue(g.edges().isEmpty());
    }

    @Test
    void successorsAreDependents_predecessorsAreDependencies() {
        var g = graph("A0->B0", "A0->C0", "B0->C0");
        assertEquals(List.of("B0", "C0"), List.copyOf(g.successors("A0")));
        assertEquals(List.of("A0", "B0"), List.copyOf(g.predecessors("C0")));
        assertEquals(0, g.inDegree("A0"));
        assertEquals(2, g.inDegree("C0"));
    }

    @Test
    void edgesAreReadOnly() {
        var g = graph("A0->B0");
        assertThrows(UnsupportedOperationException.class, () -> g.edges().clear());
        assertThrows(UnsupportedOperationException.class, () -> g.successors("A0").clear());
    }

    @Test
    void adjacencyViews_followCurrentNames() {
        var g = graph("A0->B0", "A0->C0");
        assertEquals(Map.of("A0", List.of("B0", "C0"), "B0", List.of(), "C0", List.of()), g.successorsByName());
        assertEquals(Map.of("A0", List.of(), "B0", List.of("A0"), "C0", List.of("A0")), g.predecessorsByName());

        g.node("A0").rename("a1");

        assertEquals(List.of("B0", "C0"), g.successorsByName().get("a1"));
        assertEquals(List.of("a1"), g.predecessorsByName().get("B0"));
        assertFalse(g.successorsByName().containsKey("A0"));
    }

    @Test
    void adjacencyViews_areIdempotent() {
        var g = graph("A0->B0", "B0->C0", "C0->A0");
        assertEquals(g.successorsByName(), g.successorsByName());
        assertEquals(g.predecessorsByName(), g.predecessorsByName());
    }
}
