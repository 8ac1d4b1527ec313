package edu.kit.kastel.vads.flowchart.ir.node;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

/// A single target-language statement, or a [Marker] sentinel.
public final class OperationNode extends SequentialNode {
    private final String code;

    public OperationNode(FlowGraph graph, String code) {
        super(graph);
        this.code = code;
    }

    public String code() {
        return this.code;
    }

    public boolean isMarker() {
        return Marker.fromText(this.code).isPresent();
    }

    @Override
    public <T, R> R accept(FlowNodeVisitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    protected String info() {
        return this.code;
    }
}
