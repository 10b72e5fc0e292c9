package com.hcltech.lineage.tools;

import com.hcltech.lineage.common.codec.Codec;
import com.hcltech.lineage.common.codec.JacksonTypedJsonCodec;
import com.hcltech.lineage.common.random.IRandom;
import com.hcltech.lineage.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates a random graph, layers it, transforms it layer by layer and reports the lineage.
 * Configured through {@link LayeringConfig}.
 */
public class LayeringApp {
    private static final Logger log = LoggerFactory.getLogger(LayeringApp.class);

    private final LayeringConfig config;

    public LayeringApp(LayeringConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        LayeringConfig config = LayeringConfig.load().validate()
                .fold(c -> c, errors -> {
                    throw new IllegalStateException("Invalid configuration: " + errors);
                });
        config.logImportantConfig();
        new LayeringApp(config).run();
    }

    public LineageSnapshot run() {
        IRandom random = config.random();
        DependencyGraph graph = RandomGraphGenerator.generate(config.nodes(), config.edgeDensity(), random);
        log.info("Metrics {}", GraphQueries.metrics(graph));
        logAdjacency("ORIGINAL GRAPH", graph);

        LayeringStrategy strategy = LayeringStrategies.named(config.strategy(), random);
        Layering layering = strategy.produceLayers(graph);
        List<List<String>> report = layering.asStrings();
        for (int i = 0; i < report.size(); i++) log.info("Level {}: {}", i, String.join(", ", report.get(i)));

        new TransformationEngine(random).transform(graph, layering, this::onLayerTransformed);

        logAdjacency("FINAL TRANSFORMED GRAPH", graph);
        LineageRecorder.record(graph).render().forEach(log::info);

        LineageSnapshot snapshot = LineageSnapshot.of(strategy.name(), random.seed(), layering, graph);
        if (config.reportJson()) {
            Codec<LineageSnapshot, String> codec = new JacksonTypedJsonCodec<>(LineageSnapshot.class).indented();
            var encoded = codec.encode(snapshot);
            encoded.ifValue(json -> log.info("Lineage JSON\n{}", json));
            encoded.ifError(errors -> log.error("Could not encode lineage: {}", errors));
        }
        return snapshot;
    }

    private void onLayerTransformed(int depth, List<Alias> layer, DependencyGraph graph) {
        logAdjacency("graph after transforming up through level " + depth, graph);
        if (depth == 0) return;
        for (Alias alias : layer) {
            GraphNode node = graph.node(alias.canonicalId());
            List<ParentRename> last = node.parentHistory().get(node.parentHistory().size() - 1);
            log.info("   {}: parents [{}]", node.displayName(),
                    last.stream().map(ParentRename::toString).collect(Collectors.joining(", ")));
        }
    }

    private static void logAdjacency(String header, DependencyGraph graph) {
        log.info("=== {} === {}", header, graph.successorsByName());
    }
}
