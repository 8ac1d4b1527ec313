package edu.kit.kastel.vads.flowchart.ir;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.node.ConditionNode;
import edu.kit.kastel.vads.flowchart.ir.node.EntryNode;
import edu.kit.kastel.vads.flowchart.ir.node.ExitNode;
import edu.kit.kastel.vads.flowchart.ir.node.Marker;
import edu.kit.kastel.vads.flowchart.ir.node.OperationNode;

/// Creates the nodes of one [FlowGraph] and stitches [ControlFlowFragment]s together.
///
/// Fragments are combined bottom-up: the parser builds the fragments of the nested statements first and then asks
/// for the fragment of the enclosing construct. Every method returns a fresh fragment; the fragments passed in
/// must not be used again afterwards.
public class GraphConstructor {
    private final FlowGraph graph;

    public GraphConstructor(String name) {
        this.graph = new FlowGraph(name);
    }

    public FlowGraph graph() {
        return this.graph;
    }

    /// A single statement.
    public ControlFlowFragment operation(String code) {
        OperationNode node = new OperationNode(this.graph, code);
        return new ControlFlowFragment(node, node);
    }

    /// The sentinel standing in for an empty statement.
    public ControlFlowFragment emptyStatement() {
        return marker(Marker.EMPTY);
    }

    /// `first; second`
    public ControlFlowFragment sequence(ControlFlowFragment first, ControlFlowFragment second) {
        first.exit().setNext(second.entry());
        return new ControlFlowFragment(first.entry(), second.exit());
    }

    /// `if condition then thenPart [else elsePart]`. Both branches meet in a join marker; without an else part
    /// the false branch leads to the join marker directly.
    public ControlFlowFragment branch(
        String condition,
        ControlFlowFragment thenPart,
        @Nullable ControlFlowFragment elsePart
    ) {
        ConditionNode conditionNode = new ConditionNode(this.graph, condition);
        conditionNode.setTrueBranch(thenPart.entry());
        OperationNode join = newMarker(Marker.JOIN);
        thenPart.exit().setNext(join);
        if (elsePart != null) {
            conditionNode.setFalseBranch(elsePart.entry());
            elsePart.exit().setNext(join);
        } else {
            conditionNode.setFalseBranch(join);
        }
        return new ControlFlowFragment(conditionNode, join);
    }

    /// `while condition do body`. The body loops back to the condition.
    public ControlFlowFragment whileLoop(String condition, ControlFlowFragment body) {
        ConditionNode conditionNode = new ConditionNode(this.graph, condition);
        conditionNode.setTrueBranch(body.entry());
        body.exit().setNext(conditionNode);
        OperationNode after = newMarker(Marker.AFTER_WHILE);
        conditionNode.setFalseBranch(after);
        return new ControlFlowFragment(conditionNode, after);
    }

    /// A counting loop: `init`, then `body` followed by `step` for as long as `condition` holds.
    public ControlFlowFragment forLoop(String init, String condition, String step, ControlFlowFragment body) {
        OperationNode initNode = new OperationNode(this.graph, init);
        ConditionNode conditionNode = new ConditionNode(this.graph, condition);
        OperationNode stepNode = new OperationNode(this.graph, step);
        initNode.setNext(conditionNode);
        conditionNode.setTrueBranch(body.entry());
        body.exit().setNext(stepNode);
        stepNode.setNext(conditionNode);
        OperationNode after = newMarker(Marker.AFTER_FOR);
        conditionNode.setFalseBranch(after);
        return new ControlFlowFragment(initNode, after);
    }

    /// `repeat body until condition`. The loop is left once the condition holds and re-entered while it does not.
    public ControlFlowFragment repeatUntil(ControlFlowFragment body, String condition) {
        ConditionNode conditionNode = new ConditionNode(this.graph, condition);
        body.exit().setNext(conditionNode);
        OperationNode after = newMarker(Marker.AFTER_REPEAT);
        conditionNode.setTrueBranch(after);
        conditionNode.setFalseBranch(body.entry());
        return new ControlFlowFragment(body.entry(), after);
    }

    /// Wraps the program body between the entry and exit markers and returns the finished graph.
    public FlowGraph program(ControlFlowFragment body) {
        EntryNode entry = new EntryNode(this.graph);
        ExitNode exit = new ExitNode(this.graph);
        entry.setNext(body.entry());
        body.exit().setNext(exit);
        return this.graph;
    }

    private ControlFlowFragment marker(Marker marker) {
        OperationNode node = newMarker(marker);
        return new ControlFlowFragment(node, node);
    }

    private OperationNode newMarker(Marker marker) {
        return new OperationNode(this.graph, marker.text());
    }
}
