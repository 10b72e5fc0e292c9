package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.random.IRandom;

import java.util.List;
import java.util.Locale;

public final class LayeringStrategies {
    public static final List<String> NAMES = List.of("reachability", "kahn");

    private LayeringStrategies() {}

    public static LayeringStrategy named(String name, IRandom random) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "reachability":
                return new ReachabilityLayering(random);
            case "kahn":
                return new KahnLayering();
            default:
                throw new IllegalArgumentException("Unknown layering strategy '" + name + "'; expected one of " + NAMES);
        }
    }
}
