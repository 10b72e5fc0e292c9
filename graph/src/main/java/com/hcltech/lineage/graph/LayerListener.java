package com.hcltech.lineage.graph;

import java.util.List;

/** Called once a layer is fully transformed, before the next layer starts. */
@FunctionalInterface
public interface LayerListener {
    LayerListener NONE = (depth, layer, graph) -> {};

    void onLayerTransformed(int depth, List<Alias> layer, DependencyGraph graph);
}
