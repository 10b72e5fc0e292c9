package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.random.IRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies the rename bump to every alias, layer by layer, and records lineage on the nodes.
 * <p>
 * Layer k is finished, and the listener told, before layer k+1 begins; within a layer aliases are
 * visited in produced order. For every alias outside layer 0 the node also records one parent
 * snapshot: for each direct upstream neighbor, its name when the layer began and its name at the
 * moment this node is renamed.
 */
public final class TransformationEngine {
    private static final Logger log = LoggerFactory.getLogger(TransformationEngine.class);

    private final IRandom random;

    public TransformationEngine(IRandom random) {
        this.random = Objects.requireNonNull(random);
    }

    public int transform(DependencyGraph graph, Layering layering) {
        return transform(graph, layering, LayerListener.NONE);
    }

    /** Returns the number of renames applied. */
    public int transform(DependencyGraph graph, Layering layering, LayerListener listener) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(layering);
        Objects.requireNonNull(listener);

        int renames = 0;
        for (int depth = 0; depth < layering.layerCount(); depth++) {
            List<Alias> layer = layering.layer(depth);
            Map<String, String> namesAtStart = currentNames(graph);
            for (Alias alias : layer) {
                GraphNode node = graph.node(alias.canonicalId());
                String old = node.displayName();
                String renamed = NodeName.parse(old).bump(random).toString();
                node.rename(renamed);
                renames++;
                if (depth > 0) node.recordParents(parentsOf(graph, node.canonicalId(), namesAtStart));
                log.debug("Layer {} {}: {} -> {}", depth, alias, old, renamed);
            }
            listener.onLayerTransformed(depth, layer, graph);
        }
        log.info("Transformed {} layer(s), {} rename(s), seed={}", layering.layerCount(), renames, random.seed());
        return renames;
    }

    private static List<ParentRename> parentsOf(DependencyGraph graph, String canonicalId, Map<String, String> namesAtStart) {
        List<ParentRename> parents = new ArrayList<>();
        for (String p : graph.predecessors(canonicalId))
            parents.add(new ParentRename(namesAtStart.get(p), graph.node(p).displayName()));
        return parents;
    }

    private static Map<String, String> currentNames(DependencyGraph graph) {
        Map<String, String> names = new HashMap<>();
        for (GraphNode n : graph.nodes()) names.put(n.canonicalId(), n.displayName());
        return names;
    }
}
