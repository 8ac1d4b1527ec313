package edu.kit.kastel.vads.flowchart.ir.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.flowchart.ir.ControlFlowFragment;
import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.ir.GraphConstructor;

class GraphVizPrinterTest {
    private final GraphConstructor constructor = new GraphConstructor("main");

    @Test
    void printsShapesPerNodeKind() {
        ControlFlowFragment branch = constructor.branch("(a > 0)", constructor.operation("a = 1;"), null);
        FlowGraph graph = constructor.program(branch);
        String dot = GraphVizPrinter.print(graph);

        assertTrue(dot.startsWith("digraph \"main\" {\n"));
        assertTrue(dot.endsWith("}\n"));
        assertTrue(dot.contains("n" + graph.entry().id() + " [label=\"START\", shape=oval];"));
        assertTrue(dot.contains("n" + graph.exit().id() + " [label=\"END\", shape=oval];"));
        assertTrue(dot.contains("[label=\"(a > 0)\", shape=diamond];"));
        assertTrue(dot.contains("[label=\"a = 1;\", shape=box];"));
        assertTrue(dot.contains("[label=\"/* join */\", shape=box, style=dashed, fontcolor=gray];"));
        assertTrue(dot.contains("[label=\"T\"]"));
        assertTrue(dot.contains("[label=\"F\"]"));
        assertFalse(dot.contains("constraint=false"));
    }

    @Test
    void backEdgesDoNotRank() {
        ControlFlowFragment body = constructor.operation("a = (a + 1);");
        ControlFlowFragment loop = constructor.whileLoop("(a < 5)", body);
        constructor.program(loop);
        String dot = GraphVizPrinter.print(constructor.graph());
        assertTrue(dot.contains(
            "n" + body.exit().id() + " -> n" + loop.entry().id() + " [style=dashed, constraint=false];"));
    }

    @Test
    void repeatBackEdgeKeepsItsBranchLabel() {
        ControlFlowFragment body = constructor.operation("a = (a + 1);");
        constructor.program(constructor.repeatUntil(body, "(a > 5)"));
        String dot = GraphVizPrinter.print(constructor.graph());
        assertTrue(dot.contains("-> n" + body.entry().id() + " [label=\"F\", style=dashed, constraint=false];"));
    }

    @Test
    void escapesQuotesAndBackslashes() {
        assertEquals("printf(\\\"%d\\\\n\\\", s);", GraphVizPrinter.escape("printf(\"%d\\n\", s);"));
    }
}
