package com.hcltech.lineage.graph;

import java.util.Comparator;

public final class LineageRecorder {
    private LineageRecorder() {}

    /** Pure read of the current node state. */
    public static LineageReport record(DependencyGraph graph) {
        return new LineageReport(graph.nodes().stream()
                .sorted(Comparator.comparing(GraphNode::canonicalId))
                .map(NodeLineage::of)
                .toList());
    }
}
