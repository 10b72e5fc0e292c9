package com.hcltech.lineage.graph;

import java.util.Objects;

/** One entry of a node's rename history. */
public record RenameStep(String oldName, String newName) {
    public RenameStep {
        Objects.requireNonNull(oldName, "oldName");
        Objects.requireNonNull(newName, "newName");
    }

    @Override
    public String toString() {
        return oldName + "→" + newName;
    }
}
