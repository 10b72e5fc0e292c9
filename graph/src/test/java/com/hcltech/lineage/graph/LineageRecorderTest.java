package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.random.IRandom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.lineage.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class LineageRecorderTest {

    @Test
    void report_isSortedByCanonicalId() {
        var g = graph(List.of("C0", "A0", "B0"));
        List<String> ids = LineageRecorder.record(g).nodes().stream().map(NodeLineage::canonicalId).toList();
        assertEquals(List.of("A0", "B0", "C0"), ids);
    }

    @Test
    void report_carriesRenamesAndParentSnapshots() {
        var g = graph("A0->B0");
        new TransformationEngine(ScriptedRandom.doubles(0.0, 0.9)).transform(g, new KahnLayering().produceLayers(g));

        LineageReport report = LineageRecorder.record(g);
        NodeLineage b = report.node("B0").orElseThrow();
        assertEquals("b1", b.displayName());
        assertEquals(1, b.transformCount());
        assertEquals(List.of(new RenameStep("B0", "b1")), b.renames());
        assertEquals(List.of(List.of(new ParentRename("A1", "A1"))), b.parentSnapshots());
        assertTrue(report.node("Z0").isEmpty());
    }

    @Test
    void render_listsTransformsThenParentSteps() {
        var g = graph("A0->B0");
        new TransformationEngine(ScriptedRandom.doubles(0.0, 0.9)).transform(g, new KahnLayering().produceLayers(g));

        assertEquals(List.of(
                "A0:",
                "   transforms (1): [A0→A1]",
                "B0:",
                "   transforms (1): [B0→b1]",
                "   step 1 parent map: [A1→A1]"), LineageRecorder.record(g).render());
    }

    @Test
    void untransformedGraph_hasEmptyHistories() {
        var report = LineageRecorder.record(graph("A0->B0"));
        assertEquals(List.of("A0:", "   transforms (0): []", "B0:", "   transforms (0): []"), report.render());
    }

    @Test
    void recordingTwice_givesTheSameReport() {
        DependencyGraph g = RandomGraphGenerator.generate(9, 0.3, IRandom.seeded(4));
        IRandom random = IRandom.seeded(4);
        new TransformationEngine(random).transform(g, new ReachabilityLayering(random).produceLayers(g));

        assertEquals(LineageRecorder.record(g), LineageRecorder.record(g));
        assertEquals(LineageRecorder.record(g).render(), LineageRecorder.record(g).render());
    }
}
