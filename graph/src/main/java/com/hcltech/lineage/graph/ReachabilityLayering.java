package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.random.IRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Breadth-first layering that duplicates a node each time another of its incoming edges is reached.
 * <p>
 * Layer 0 holds the roots. Each alias in a layer follows its canonical node's outgoing edges; every
 * edge not yet consumed mints a new alias of its target into the next layer. Each edge is consumed at
 * most once, so cycles terminate after at most one layer per edge. When the graph has no root, one node
 * is picked through the random source and its incoming edges sit out this run.
 */
public final class ReachabilityLayering implements LayeringStrategy {
    private static final Logger log = LoggerFactory.getLogger(ReachabilityLayering.class);

    private final IRandom random;

    public ReachabilityLayering(IRandom random) {
        this.random = Objects.requireNonNull(random);
    }

    @Override
    public String name() {
        return "reachability";
    }

    @Override
    public Layering produceLayers(DependencyGraph graph) {
        if (graph.isEmpty()) return Layering.empty();

        AliasMinter minter = new AliasMinter();
        List<String> forced = new ArrayList<>();
        Set<Edge> excluded = new HashSet<>();

        List<String> roots = GraphQueries.roots(graph);
        if (roots.isEmpty()) {
            List<String> ids = graph.canonicalIds();
            String root = ids.get(random.nextInt(ids.size()));
            for (String p : graph.predecessors(root)) excluded.add(new Edge(p, root));
            roots = List.of(root);
            forced.add(root);
            log.debug("No roots; forcing {} and ignoring its {} incoming edge(s)", root, excluded.size());
        }

        List<List<Alias>> layers = new ArrayList<>();
        Set<Edge> processed = new LinkedHashSet<>();
        List<Alias> current = new ArrayList<>();
        for (String r : roots) current.add(minter.mint(r));
        layers.add(current);

        while (true) {
            List<Alias> next = new ArrayList<>();
            for (Alias alias : current) {
                String source = alias.canonicalId();
                for (String target : graph.successors(source)) {
                    Edge edge = new Edge(source, target);
                    if (excluded.contains(edge) || !processed.add(edge)) continue;
                    next.add(minter.mint(target));
                }
            }
            if (next.isEmpty()) break;
            log.debug("Layer {}: {}", layers.size(), next);
            layers.add(next);
            current = next;
        }

        Layering layering = new Layering(layers, new ArrayList<>(processed), forced);
        log.info("{} layering: layers={} aliases={} processedEdges={}/{} forced={}",
                name(), layering.layerCount(), layering.aliasCount(), processed.size(), graph.edges().size(), forced);
        return layering;
    }
}
