package com.hcltech.lineage.common;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Keeps {@link System#getenv(String)} out of configuration code so tests can supply their own environment.
 */
@FunctionalInterface
public interface IEnvGetter {
    IEnvGetter env = System::getenv;

    /** Returns the value of the given environment variable, or {@code null} if unset. */
    @Nullable
    String get(String name);

    /** Environment variable name for a dotted property key: {@code graph.edge.density -> GRAPH_EDGE_DENSITY}. */
    static String toEnvKey(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
