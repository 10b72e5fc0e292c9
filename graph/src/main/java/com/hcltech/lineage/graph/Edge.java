package com.hcltech.lineage.graph;

import java.util.Objects;

/** {@code target} depends on {@code source}; the target is laid out after the source. */
public record Edge(String source, String target) {
    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public boolean selfLoop() {
        return source.equals(target);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
