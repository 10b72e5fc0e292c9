package com.hcltech.lineage.graph;

/** Input description of a node: its canonical id and initial display name. */
public record NodeSpec(String canonicalId, String displayName) {

    /** The common case where the canonical id is the initial display name. */
    public static NodeSpec named(String name) {
        return new NodeSpec(name, name);
    }
}
