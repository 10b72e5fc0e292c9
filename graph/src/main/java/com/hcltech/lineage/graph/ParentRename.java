package com.hcltech.lineage.graph;

import java.util.Objects;

/** How one upstream neighbor was named when the layer began, and when the child was transformed. */
public record ParentRename(String before, String after) {
    public ParentRename {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    @Override
    public String toString() {
        return before + "→" + after;
    }
}
