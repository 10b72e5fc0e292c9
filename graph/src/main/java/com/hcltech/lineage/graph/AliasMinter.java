package com.hcltech.lineage.graph;

import java.util.HashMap;
import java.util.Map;

/** Per-run alias counters. A fresh minter per layering run; never shared. */
final class AliasMinter {
    private final Map<String, Integer> minted = new HashMap<>();

    Alias mint(String canonicalId) {
        int k = minted.merge(canonicalId, 1, Integer::sum) - 1;
        return new Alias(canonicalId, k);
    }
}
