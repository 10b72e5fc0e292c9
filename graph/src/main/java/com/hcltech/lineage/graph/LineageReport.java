package com.hcltech.lineage.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Per-node lineage, ordered by canonical id. */
public record LineageReport(List<NodeLineage> nodes) {
    public LineageReport {
        nodes = List.copyOf(nodes);
    }

    public Optional<NodeLineage> node(String canonicalId) {
        return nodes.stream().filter(n -> n.canonicalId().equals(canonicalId)).findFirst();
    }

    /**
     * <pre>
     * A0:
     *    transforms (2): [A0→a1, a1→A2]
     *    step 1 parent map: [B0→B1]
     * </pre>
     */
    public List<String> render() {
        List<String> lines = new ArrayList<>();
        for (NodeLineage n : nodes) {
            lines.add(n.canonicalId() + ":");
            lines.add("   transforms (" + n.transformCount() + "): " + n.renames());
            int step = 1;
            for (List<ParentRename> parents : n.parentSnapshots()) {
                String pretty = parents.stream().map(ParentRename::toString).collect(Collectors.joining(", "));
                lines.add("   step " + step++ + " parent map: [" + pretty + "]");
            }
        }
        return lines;
    }
}
