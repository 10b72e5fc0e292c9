package com.hcltech.lineage.graph;

/**
 * Turns a possibly cyclic graph into ordered layers of aliases. Implementations never modify the
 * graph's edges, and an empty graph yields {@link Layering#empty()}.
 */
public interface LayeringStrategy {
    Layering produceLayers(DependencyGraph graph);

    /** Short name used in configuration and logs. */
    String name();
}
