package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.random.IRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Random dependency graphs for demos and property tests. Reproducible only through a seeded
 * {@link IRandom}.
 */
public final class RandomGraphGenerator {
    private static final Logger log = LoggerFactory.getLogger(RandomGraphGenerator.class);

    private RandomGraphGenerator() {}

    /**
     * Nodes are {@code A0, B0, ...} (canonical id == initial name). Each ordered pair of distinct nodes
     * becomes an edge with probability {@code edgeDensity}. When that leaves no node without incoming
     * edges, one node is picked and its incoming edges are dropped so the graph has a root.
     */
    public static DependencyGraph generate(int nodeCount, double edgeDensity, IRandom random) {
        if (nodeCount < 0) throw new IllegalArgumentException("nodeCount must be >= 0 but was " + nodeCount);
        if (!(edgeDensity >= 0.0 && edgeDensity <= 1.0))
            throw new IllegalArgumentException("edgeDensity must be within [0, 1] but was " + edgeDensity);

        List<String> names = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) names.add(NodeName.nth(i));

        List<Edge> edges = new ArrayList<>();
        int[] inDegree = new int[nodeCount];
        for (int s = 0; s < nodeCount; s++) {
            for (int d = 0; d < nodeCount; d++) {
                if (s == d) continue;
                if (random.nextDouble() < edgeDensity) {
                    edges.add(new Edge(names.get(s), names.get(d)));
                    inDegree[d]++;
                }
            }
        }

        if (nodeCount > 0 && noRoot(inDegree)) {
            String root = names.get(random.nextInt(nodeCount));
            edges.removeIf(e -> e.target().equals(root));
            log.debug("No root generated; dropped incoming edges of {}", root);
        }

        DependencyGraph graph = DependencyGraphBuilder.build(names.stream().map(NodeSpec::named).toList(), edges)
                .valueOrThrow();
        log.info("Generated graph nodes={} edges={} density={} seed={}",
                graph.size(), graph.edges().size(), edgeDensity, random.seed());
        return graph;
    }

    private static boolean noRoot(int[] inDegree) {
        for (int d : inDegree) if (d == 0) return false;
        return true;
    }
}
