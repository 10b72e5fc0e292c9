package com.hcltech.lineage.graph;

import java.util.Objects;

/**
 * One occurrence of a canonical node within a single layering run. Index 0 renders as the bare id,
 * later occurrences as {@code id#k}.
 */
public record Alias(String canonicalId, int index) {
    public static final char SEPARATOR = '#';

    public Alias {
        Objects.requireNonNull(canonicalId, "canonicalId");
        if (canonicalId.indexOf(SEPARATOR) >= 0)
            throw new IllegalArgumentException("canonicalId must not contain '" + SEPARATOR + "' but was " + canonicalId);
        if (index < 0) throw new IllegalArgumentException("alias index must be >= 0 but was " + index);
    }

    public static Alias parse(String alias) {
        int at = alias.lastIndexOf(SEPARATOR);
        if (at < 0) return new Alias(alias, 0);
        try {
            int k = Integer.parseInt(alias.substring(at + 1));
            if (k < 1) throw new IllegalArgumentException("Alias suffix must be >= 1 in '" + alias + "'");
            return new Alias(alias.substring(0, at), k);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed alias '" + alias + "'", e);
        }
    }

    @Override
    public String toString() {
        return index == 0 ? canonicalId : canonicalId + SEPARATOR + index;
    }
}
