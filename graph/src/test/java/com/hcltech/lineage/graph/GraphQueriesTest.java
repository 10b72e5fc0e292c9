package com.hcltech.lineage.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.hcltech.lineage.graph.GraphFixture.graph;
import static org.junit.jupiter.api.Assertions.*;

class GraphQueriesTest {

    @Test
    void roots_areNodesWithoutIncomingEdges() {
        var g = graph(List.of("X0"), "A0->B0", "C0->B0");
        assertEquals(List.of("X0", "A0", "C0"), GraphQueries.roots(g));
    }

    @Test
    void shortestPath_followsDependencyDirection() {
        var g = graph("A0->B0", "B0->C0", "A0->D0", "D0->C0", "C0->E0");
        assertEquals(Optional.of(List.of("A0", "B0", "C0", "E0")), GraphQueries.shortestPath(g, "A0", "E0"));
        assertEquals(Optional.of(List.of("C0")), GraphQueries.shortestPath(g, "C0", "C0"));
    }

    @Test
    void shortestPath_isEmptyWhenUnreachableOrUnknown() {
        var g = graph("A0->B0");
        assertEquals(Optional.empty(), GraphQueries.shortestPath(g, "B0", "A0"));
        assertEquals(Optional.empty(), GraphQueries.shortestPath(g, "A0", "Z0"));
    }

    @Test
    void stronglyConnectedComponents_groupCycles() {
        var g = graph("A0->B0", "B0->C0", "C0->A0", "C0->D0", "D0->E0", "E0->D0", "E0->F0");
        var sccs = GraphQueries.stronglyConnectedComponents(g);
        assertTrue(sccs.contains(Set.of("A0", "B0", "C0")), sccs.toString());
        assertTrue(sccs.contains(Set.of("D0", "E0")), sccs.toString());
        assertTrue(sccs.contains(Set.of("F0")), sccs.toString());
        assertEquals(3, sccs.size());
        assertFalse(GraphQueries.isAcyclic(g));
    }

    @Test
    void longChain_doesNotOverflowTheStack() {
        var g = new DependencyGraph();
        int n = 20_000;
        for (int i = 0; i < n; i++) g.addNode("N" + i, "N" + i);
        for (int i = 1; i < n; i++) g.addEdge("N" + (i - 1), "N" + i);
        assertEquals(n, GraphQueries.stronglyConnectedComponents(g).size());
        assertTrue(GraphQueries.isAcyclic(g));
    }

    @Test
    void metrics_summariseTheGraph() {
        var g = graph(List.of("X0"), "A0->B0", "B0->A0", "B0->C0");
        var m = GraphQueries.metrics(g);
        assertEquals(4, m.nodes());
        assertEquals(3, m.edges());
        assertEquals(3.0 / 12.0, m.density(), 1e-9);
        assertFalse(m.acyclic());
        assertEquals(3, m.stronglyConnectedComponents());
        assertEquals(2, m.weaklyConnectedComponents());
    }

    @Test
    void metrics_ofEmptyGraph() {
        var m = GraphQueries.metrics(new DependencyGraph());
        assertEquals(new GraphMetrics(0, 0, 0.0, true, 0, 0), m);
    }
}
