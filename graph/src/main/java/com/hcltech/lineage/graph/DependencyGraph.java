package com.hcltech.lineage.graph;

import com.hcltech.lineage.graph.exceptions.ConsistencyException;
import com.hcltech.lineage.graph.exceptions.DuplicateNodeException;
import com.hcltech.lineage.graph.exceptions.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Arena of canonical nodes plus an append-only edge set, both in insertion order.
 * <p>
 * Edge {@code s -> t} means t depends on s: {@link #successors(String)} of s are its downstream
 * dependents. Edges are never removed. Not thread safe; a run owns its graph.
 */
public final class DependencyGraph {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Map<String, Set<String>> successors = new HashMap<>();
    private final Map<String, Set<String>> predecessors = new HashMap<>();

    /** Canonical ids may not contain {@link Alias#SEPARATOR}; aliases are resolved by stripping it. */
    public GraphNode addNode(String canonicalId, String displayName) {
        Objects.requireNonNull(canonicalId, "canonicalId");
        if (canonicalId.indexOf(Alias.SEPARATOR) >= 0)
            throw new FormatException("Canonical id '" + canonicalId + "' must not contain '" + Alias.SEPARATOR + "'");
        if (nodes.containsKey(canonicalId))
            throw new DuplicateNodeException("Node " + canonicalId + " is already registered");
        GraphNode node = new GraphNode(canonicalId, displayName);
        nodes.put(canonicalId, node);
        successors.put(canonicalId, new LinkedHashSet<>());
        predecessors.put(canonicalId, new LinkedHashSet<>());
        return node;
    }

    /** Self loops are ignored and repeated edges collapse. Returns whether the edge set changed. */
    public boolean addEdge(String source, String target) {
        Edge edge = new Edge(source, target);
        requireNode(source);
        requireNode(target);
        if (edge.selfLoop()) {
            log.debug("Ignoring self loop on {}", source);
            return false;
        }
        if (!edges.add(edge)) return false;
        successors.get(source).add(target);
        predecessors.get(target).add(source);
        return true;
    }

    public boolean contains(String canonicalId) {
        return nodes.containsKey(canonicalId);
    }

    public GraphNode node(String canonicalId) {
        return requireNode(canonicalId);
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<String> canonicalIds() {
        return List.copyOf(nodes.keySet());
    }

    public Set<Edge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Set<String> successors(String canonicalId) {
        requireNode(canonicalId);
        return Collections.unmodifiableSet(successors.get(canonicalId));
    }

    public Set<String> predecessors(String canonicalId) {
        requireNode(canonicalId);
        return Collections.unmodifiableSet(predecessors.get(canonicalId));
    }

    public int inDegree(String canonicalId) {
        return predecessors(canonicalId).size();
    }

    /**
     * Current display name of each node mapped to the current names of its dependents. Throws
     * {@link ConsistencyException} if two nodes currently share a display name.
     */
    public Map<String, List<String>> successorsByName() {
        return byName(successors);
    }

    /** Current display name of each node mapped to the current names of what it depends on. Same clash rule. */
    public Map<String, List<String>> predecessorsByName() {
        return byName(predecessors);
    }

    private Map<String, List<String>> byName(Map<String, Set<String>> adjacency) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        Map<String, String> owner = new HashMap<>();
        for (GraphNode node : nodes.values()) {
            String clash = owner.putIfAbsent(node.displayName(), node.canonicalId());
            if (clash != null)
                throw new ConsistencyException("Nodes " + clash + " and " + node.canonicalId()
                        + " share display name " + node.displayName());
            List<String> names = new ArrayList<>();
            for (String id : adjacency.get(node.canonicalId())) names.add(nodes.get(id).displayName());
            result.put(node.displayName(), List.copyOf(names));
        }
        return Collections.unmodifiableMap(result);
    }

    private GraphNode requireNode(String canonicalId) {
        GraphNode node = nodes.get(canonicalId);
        if (node == null) throw new IllegalArgumentException("Unknown node " + canonicalId);
        return node;
    }

    @Override
    public String toString() {
        return "DependencyGraph(nodes=" + nodes.size() + ", edges=" + edges.size() + ")";
    }
}
