package edu.kit.kastel.vads.flowchart.ir.node;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

public final class EntryNode extends SequentialNode {
    public EntryNode(FlowGraph graph) {
        super(graph);
    }

    @Override
    public <T, R> R accept(FlowNodeVisitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}
