package edu.kit.kastel.vads.flowchart.ir.node;

import java.util.List;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

/// A node with at most one successor.
public sealed abstract class SequentialNode extends FlowNode permits EntryNode, OperationNode {
    private int next = NO_NODE;

    protected SequentialNode(FlowGraph graph) {
        super(graph);
    }

    public @Nullable FlowNode next() {
        return this.next == NO_NODE ? null : graph().node(this.next);
    }

    public void setNext(FlowNode successor) {
        if (this.next != NO_NODE) {
            throw new IllegalStateException(this + " already continues with " + next());
        }
        this.next = linkTarget(successor);
    }

    @Override
    public List<FlowNode> successors() {
        FlowNode successor = next();
        return successor == null ? List.of() : List.of(successor);
    }
}
