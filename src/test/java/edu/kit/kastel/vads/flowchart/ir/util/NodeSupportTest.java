package edu.kit.kastel.vads.flowchart.ir.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.flowchart.ir.ControlFlowFragment;
import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.ir.GraphConstructor;
import edu.kit.kastel.vads.flowchart.ir.node.ConditionNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;
import edu.kit.kastel.vads.flowchart.ir.node.OperationNode;

class NodeSupportTest {
    private final GraphConstructor constructor = new GraphConstructor("support");

    @Test
    void reachableVisitsTrueBranchFirst() {
        ControlFlowFragment thenPart = constructor.operation("a = 1;");
        ControlFlowFragment elsePart = constructor.operation("a = 2;");
        ControlFlowFragment branch = constructor.branch("(a > 0)", thenPart, elsePart);
        FlowGraph graph = constructor.program(branch);

        List<FlowNode> order = new ArrayList<>(NodeSupport.reachable(graph.entry()));
        assertEquals(List.of(
            graph.entry(), branch.entry(), thenPart.entry(), branch.exit(), graph.exit(), elsePart.entry()
        ), order);
    }

    @Test
    void reachableTerminatesOnCycles() {
        ControlFlowFragment loop = constructor.whileLoop("(a < 5)", constructor.operation("a = (a + 1);"));
        FlowGraph graph = constructor.program(loop);
        assertEquals(graph.size(), NodeSupport.reachable(graph.entry()).size());
    }

    @Test
    void markersAreRecognizedByText() {
        ControlFlowFragment empty = constructor.emptyStatement();
        assertTrue(NodeSupport.isMarker(empty.entry()));
        assertFalse(NodeSupport.isMarker(constructor.operation("a = 1;").entry()));
        assertFalse(NodeSupport.isMarker(new ConditionNode(constructor.graph(), "(a > 0)")));
    }

    @Test
    void skipMarkersFindsTheNextRealNode() {
        ControlFlowFragment first = constructor.emptyStatement();
        ControlFlowFragment second = constructor.emptyStatement();
        ControlFlowFragment real = constructor.operation("a = 1;");
        constructor.sequence(constructor.sequence(first, second), real);
        assertSame(real.entry(), NodeSupport.skipMarkers(first.entry()));
        assertSame(real.entry(), NodeSupport.skipMarkers(real.entry()));
        assertNull(NodeSupport.skipMarkers(null));
    }

    @Test
    void skipMarkersGivesUpOnAMarkerChainWithoutEnd() {
        OperationNode marker = (OperationNode) constructor.emptyStatement().entry();
        assertNull(NodeSupport.skipMarkers(marker));
        marker.setNext(marker);
        assertNull(NodeSupport.skipMarkers(marker));
    }

    @Test
    void loopConditionsReachThemselves() {
        ControlFlowFragment loop = constructor.whileLoop("(a < 5)", constructor.operation("a = (a + 1);"));
        assertTrue(NodeSupport.isLoopCondition((ConditionNode) loop.entry()));
        ControlFlowFragment branch = constructor.branch("(a > 0)", constructor.operation("b = 1;"), null);
        assertFalse(NodeSupport.isLoopCondition((ConditionNode) branch.entry()));
    }

    @Test
    void conditionsNestedInLoopsCountAsLoopConditions() {
        ControlFlowFragment branch = constructor.branch("(a > 2)", constructor.operation("b = 1;"), null);
        ControlFlowFragment body = constructor.sequence(branch, constructor.operation("a = (a + 1);"));
        constructor.whileLoop("(a < 5)", body);
        assertTrue(NodeSupport.isLoopCondition((ConditionNode) branch.entry()));
    }
}
