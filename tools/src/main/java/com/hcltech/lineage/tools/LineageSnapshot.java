package com.hcltech.lineage.tools;

import com.hcltech.lineage.graph.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON shape of a finished run: canonical id to node state, plus the layers and edge list. */
public record LineageSnapshot(
        String strategy,
        long seed,
        List<List<String>> layers,
        List<Edge> edges,
        Map<String, NodeState> nodes
) {
    public record NodeState(
            String displayName,
            int transformCount,
            List<RenameStep> renameHistory,
            List<List<ParentRename>> parentHistory
    ) {}

    public static LineageSnapshot of(String strategy, long seed, Layering layering, DependencyGraph graph) {
        Map<String, NodeState> nodes = new LinkedHashMap<>();
        for (NodeLineage n : LineageRecorder.record(graph).nodes())
            nodes.put(n.canonicalId(), new NodeState(n.displayName(), n.transformCount(), n.renames(), n.parentSnapshots()));
        return new LineageSnapshot(strategy, seed, layering.asStrings(), List.copyOf(graph.edges()), nodes);
    }
}
