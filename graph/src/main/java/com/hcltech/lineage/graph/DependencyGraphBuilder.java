package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.errorsor.ErrorsOr;

import java.util.*;

public final class DependencyGraphBuilder {
    private DependencyGraphBuilder() {}

    /**
     * Validates the whole input and reports every problem before building anything. Never throws for
     * bad input.
     * <p>
     * Display names are compared ignoring case: the rename bump picks the case at random, so
     * {@code a0} and {@code A0} would both become {@code A1}.
     */
    public static ErrorsOr<DependencyGraph> build(List<NodeSpec> nodes, List<Edge> edges) {
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(edges);

        List<String> errors = new ArrayList<>();
        Set<String> ids = new LinkedHashSet<>();
        Map<String, String> nameOwners = new HashMap<>();
        for (NodeSpec spec : nodes) {
            String id = spec.canonicalId();
            if (id == null || id.isBlank()) {
                errors.add("Blank canonical id for display name " + spec.displayName());
                continue;
            }
            if (!ids.add(id)) {
                errors.add("Duplicate canonical id " + id);
                continue;
            }
            if (id.indexOf(Alias.SEPARATOR) >= 0)
                errors.add("Canonical id " + id + " must not contain '" + Alias.SEPARATOR + "'");
            if (!NodeName.isValid(spec.displayName())) {
                errors.add("Malformed display name '" + spec.displayName() + "' for " + id);
                continue;
            }
            String clash = nameOwners.putIfAbsent(spec.displayName().toLowerCase(Locale.ROOT), id);
            if (clash != null)
                errors.add("Display name '" + spec.displayName() + "' of " + id + " clashes with the name of " + clash);
        }
        for (Edge e : edges) {
            if (!ids.contains(e.source())) errors.add("Edge " + e + " has unknown source " + e.source());
            if (!ids.contains(e.target())) errors.add("Edge " + e + " has unknown target " + e.target());
            if (e.selfLoop()) errors.add("Self loop " + e + " is not allowed");
        }
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);

        DependencyGraph graph = new DependencyGraph();
        for (NodeSpec spec : nodes) graph.addNode(spec.canonicalId(), spec.displayName());
        for (Edge e : edges) graph.addEdge(e.source(), e.target());
        return ErrorsOr.lift(graph);
    }

    /** Nodes named by their canonical ids; edges given as {@code "A0->B0"} strings. */
    public static ErrorsOr<DependencyGraph> parse(List<String> names, List<String> edges) {
        return parseEdges(edges).flatMap(parsed -> build(names.stream().map(NodeSpec::named).toList(), parsed));
    }

    private static ErrorsOr<List<Edge>> parseEdges(List<String> edges) {
        List<String> errors = new ArrayList<>();
        List<Edge> parsed = new ArrayList<>();
        for (String raw : edges) {
            String[] parts = raw.split("->", -1);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                errors.add("Edge '" + raw + "' is not of the form source->target");
            } else {
                parsed.add(new Edge(parts[0].trim(), parts[1].trim()));
            }
        }
        return errors.isEmpty() ? ErrorsOr.lift(parsed) : ErrorsOr.errors(errors);
    }
}
