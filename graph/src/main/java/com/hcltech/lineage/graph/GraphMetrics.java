package com.hcltech.lineage.graph;

public record GraphMetrics(
        int nodes,
        int edges,
        double density,
        boolean acyclic,
        int stronglyConnectedComponents,
        int weaklyConnectedComponents
) {}
