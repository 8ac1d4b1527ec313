package edu.kit.kastel.vads.flowchart.ir.node;

import java.util.List;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

public final class ExitNode extends FlowNode {
    public ExitNode(FlowGraph graph) {
        super(graph);
    }

    @Override
    public List<FlowNode> successors() {
        return List.of();
    }

    @Override
    public <T, R> R accept(FlowNodeVisitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}
