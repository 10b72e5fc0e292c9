package com.hcltech.lineage.graph;

import java.util.*;

/** Read-only structural queries. None of them throw for "not found"; absence is an empty result. */
public final class GraphQueries {
    private GraphQueries() {}

    /** Nodes with no incoming edges, in insertion order. */
    public static List<String> roots(DependencyGraph graph) {
        List<String> roots = new ArrayList<>();
        for (String id : graph.canonicalIds()) if (graph.inDegree(id) == 0) roots.add(id);
        return roots;
    }

    /** Fewest-edges path following dependency direction, both ends included. */
    public static Optional<List<String>> shortestPath(DependencyGraph graph, String from, String to) {
        if (!graph.contains(from) || !graph.contains(to)) return Optional.empty();
        if (from.equals(to)) return Optional.of(List.of(from));

        Map<String, String> cameFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        cameFrom.put(from, from);
        while (!queue.isEmpty()) {
            String n = queue.poll();
            for (String m : graph.successors(n)) {
                if (cameFrom.containsKey(m)) continue;
                cameFrom.put(m, n);
                if (m.equals(to)) return Optional.of(walkBack(cameFrom, from, to));
                queue.add(m);
            }
        }
        return Optional.empty();
    }

    private static List<String> walkBack(Map<String, String> cameFrom, String from, String to) {
        LinkedList<String> path = new LinkedList<>();
        for (String at = to; !at.equals(from); at = cameFrom.get(at)) path.addFirst(at);
        path.addFirst(from);
        return List.copyOf(path);
    }

    /**
     * Tarjan's algorithm with an explicit stack, so deep chains cannot overflow the call stack.
     * Components come out in reverse topological order of the condensation.
     */
    public static List<Set<String>> stronglyConnectedComponents(DependencyGraph graph) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> low = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<Set<String>> result = new ArrayList<>();
        int counter = 0;

        for (String start : graph.canonicalIds()) {
            if (index.containsKey(start)) continue;
            Deque<Map.Entry<String, Iterator<String>>> work = new ArrayDeque<>();
            index.put(start, counter);
            low.put(start, counter++);
            stack.push(start);
            onStack.add(start);
            work.push(Map.entry(start, graph.successors(start).iterator()));

            while (!work.isEmpty()) {
                var frame = work.peek();
                String v = frame.getKey();
                Iterator<String> it = frame.getValue();
                if (it.hasNext()) {
                    String w = it.next();
                    if (!index.containsKey(w)) {
                        index.put(w, counter);
                        low.put(w, counter++);
                        stack.push(w);
                        onStack.add(w);
                        work.push(Map.entry(w, graph.successors(w).iterator()));
                    } else if (onStack.contains(w)) {
                        low.put(v, Math.min(low.get(v), index.get(w)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().getKey();
                    low.put(parent, Math.min(low.get(parent), low.get(v)));
                }
                if (low.get(v).equals(index.get(v))) {
                    Set<String> component = new LinkedHashSet<>();
                    String w;
                    do {
                        w = stack.pop();
                        onStack.remove(w);
                        component.add(w);
                    } while (!w.equals(v));
                    result.add(component);
                }
            }
        }
        return result;
    }

    public static boolean isAcyclic(DependencyGraph graph) {
        // self loops never enter the edge set, so any cycle lives in a component of size > 1
        return stronglyConnectedComponents(graph).stream().allMatch(c -> c.size() == 1);
    }

    public static int weaklyConnectedComponents(DependencyGraph graph) {
        Set<String> seen = new HashSet<>();
        int components = 0;
        for (String start : graph.canonicalIds()) {
            if (!seen.add(start)) continue;
            components++;
            Deque<String> queue = new ArrayDeque<>(List.of(start));
            while (!queue.isEmpty()) {
                String n = queue.poll();
                for (String m : graph.successors(n)) if (seen.add(m)) queue.add(m);
                for (String m : graph.predecessors(n)) if (seen.add(m)) queue.add(m);
            }
        }
        return components;
    }

    public static GraphMetrics metrics(DependencyGraph graph) {
        int n = graph.size();
        int e = graph.edges().size();
        double density = n < 2 ? 0.0 : (double) e / ((double) n * (n - 1));
        List<Set<String>> sccs = stronglyConnectedComponents(graph);
        boolean acyclic = sccs.stream().allMatch(c -> c.size() == 1);
        return new GraphMetrics(n, e, density, acyclic, sccs.size(), weaklyConnectedComponents(graph));
    }
}
