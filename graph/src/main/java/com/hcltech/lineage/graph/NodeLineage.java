package com.hcltech.lineage.graph;

import java.util.List;

public record NodeLineage(
        String canonicalId,
        String displayName,
        int transformCount,
        List<RenameStep> renames,
        List<List<ParentRename>> parentSnapshots
) {
    public NodeLineage {
        renames = List.copyOf(renames);
        parentSnapshots = parentSnapshots.stream().map(List::copyOf).toList();
    }

    static NodeLineage of(GraphNode node) {
        return new NodeLineage(node.canonicalId(), node.displayName(), node.transformCount(),
                node.renameHistory(), node.parentHistory());
    }
}
