package com.hcltech.lineage.graph;

import java.util.List;

/**
 * Result of one layering run.
 *
 * @param layers         aliases grouped by layer; layer index is processing order
 * @param processedEdges the edges consumed while building the layers, in the order they were consumed
 * @param forced         canonical ids placed by a forced root or forced cycle break, in order
 */
public record Layering(List<List<Alias>> layers, List<Edge> processedEdges, List<String> forced) {
    public Layering {
        layers = layers.stream().map(List::copyOf).toList();
        processedEdges = List.copyOf(processedEdges);
        forced = List.copyOf(forced);
    }

    public static Layering empty() {
        return new Layering(List.of(), List.of(), List.of());
    }

    public int layerCount() {
        return layers.size();
    }

    public int aliasCount() {
        return layers.stream().mapToInt(List::size).sum();
    }

    public List<Alias> layer(int depth) {
        return layers.get(depth);
    }

    /** The layer report: every alias rendered as a string. */
    public List<List<String>> asStrings() {
        return layers.stream().map(l -> l.stream().map(Alias::toString).toList()).toList();
    }
}
