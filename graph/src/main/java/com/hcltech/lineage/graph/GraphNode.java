package com.hcltech.lineage.graph;

import com.hcltech.lineage.graph.exceptions.FormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One dependency unit. The canonical id never changes; the display name and the histories are
 * mutated only by {@link TransformationEngine}, one layer at a time.
 */
public final class GraphNode {
    private final String canonicalId;
    private String displayName;
    private int transformCount;
    private final List<RenameStep> renameHistory = new ArrayList<>();
    private final List<List<ParentRename>> parentHistory = new ArrayList<>();

    public GraphNode(String canonicalId, String displayName) {
        this.canonicalId = Objects.requireNonNull(canonicalId, "canonicalId");
        if (canonicalId.isBlank()) throw new IllegalArgumentException("canonicalId must not be blank");
        if (!NodeName.isValid(displayName))
            throw new FormatException("Display name '" + displayName + "' of node " + canonicalId
                    + " does not match <letters><digits>");
        this.displayName = displayName;
    }

    public String canonicalId() { return canonicalId; }

    public String displayName() { return displayName; }

    public int transformCount() { return transformCount; }

    public List<RenameStep> renameHistory() { return Collections.unmodifiableList(renameHistory); }

    public List<List<ParentRename>> parentHistory() { return Collections.unmodifiableList(parentHistory); }

    void rename(String newName) {
        if (!NodeName.isValid(newName))
            throw new FormatException("Cannot rename " + canonicalId + " to '" + newName + "'");
        renameHistory.add(new RenameStep(displayName, newName));
        displayName = newName;
        transformCount++;
    }

    void recordParents(List<ParentRename> parents) {
        parentHistory.add(List.copyOf(parents));
    }

    @Override
    public String toString() {
        return canonicalId + "(" + displayName + ")";
    }
}
