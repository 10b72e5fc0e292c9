package com.hcltech.lineage.graph;

import com.hcltech.lineage.graph.exceptions.ConsistencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * In-degree driven layering. Acyclic regions come out in topological order: a node lands in the layer
 * after the predecessor that released it. When the queue drains while some node still has incoming
 * edges left, the cycle is broken explicitly: the node with the lowest canonical id among those is
 * released into a new trailing layer. Every node appears exactly once.
 */
public final class KahnLayering implements LayeringStrategy {
    private static final Logger log = LoggerFactory.getLogger(KahnLayering.class);

    @Override
    public String name() {
        return "kahn";
    }

    @Override
    public Layering produceLayers(DependencyGraph graph) {
        if (graph.isEmpty()) return Layering.empty();

        Run run = new Run(graph);
        run.drain();
        Optional<String> stuck;
        while ((stuck = run.nextForcedBreak()).isPresent()) {
            run.forceBreak(stuck.get());
            run.drain();
        }

        Layering layering = run.result();
        log.info("{} layering: layers={} aliases={} forcedBreaks={}",
                name(), layering.layerCount(), layering.aliasCount(), layering.forced());
        return layering;
    }

    /** State of one layering run: in-degree counters, alias counters and the work queue. */
    static final class Run {
        private final DependencyGraph graph;
        private final Map<String, Integer> inDegree = new LinkedHashMap<>();
        private final Map<String, Integer> layerOf = new HashMap<>();
        private final AliasMinter minter = new AliasMinter();
        private final Deque<String> queue = new ArrayDeque<>();
        private final List<List<Alias>> layers = new ArrayList<>();
        private final List<Edge> processed = new ArrayList<>();
        private final List<String> forced = new ArrayList<>();

        Run(DependencyGraph graph) {
            this.graph = graph;
            for (String id : graph.canonicalIds()) inDegree.put(id, graph.inDegree(id));
            for (String id : graph.canonicalIds()) if (inDegree.get(id) == 0) place(id, 0);
        }

        void drain() {
            while (!queue.isEmpty()) {
                String n = queue.poll();
                int next = layerOf.get(n) + 1;
                for (String m : graph.successors(n)) {
                    processed.add(new Edge(n, m));
                    if (layerOf.containsKey(m)) continue; // already released by a forced break
                    if (inDegree.merge(m, -1, Integer::sum) == 0) place(m, next);
                }
            }
        }

        /** Lowest canonical id that still has unconsumed incoming edges. */
        Optional<String> nextForcedBreak() {
            return inDegree.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(Map.Entry::getKey)
                    .min(Comparator.naturalOrder());
        }

        void forceBreak(String canonicalId) {
            Integer remaining = inDegree.get(canonicalId);
            if (remaining == null || remaining <= 0 || layerOf.containsKey(canonicalId))
                throw new ConsistencyException("Forced break on " + canonicalId
                        + " which has no remaining in-degree (" + remaining + ")");
            log.debug("Forcing cycle break at {} with remaining in-degree {}", canonicalId, remaining);
            inDegree.put(canonicalId, 0);
            forced.add(canonicalId);
            place(canonicalId, layers.size());
        }

        private void place(String canonicalId, int depth) {
            while (layers.size() <= depth) layers.add(new ArrayList<>());
            layers.get(depth).add(minter.mint(canonicalId));
            layerOf.put(canonicalId, depth);
            queue.add(canonicalId);
        }

        int layerOf(String canonicalId) {
            return layerOf.getOrDefault(canonicalId, -1);
        }

        Layering result() {
            return new Layering(layers, processed, forced);
        }
    }
}
