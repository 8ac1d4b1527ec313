package edu.kit.kastel.vads.flowchart.ir.node;

import java.util.List;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

/// The base class for all nodes of a [FlowGraph].
///
/// A node is registered with its graph on construction and receives the next free id of that graph. Edges are
/// stored as successor ids and resolved through the graph, so a node never holds another node directly.
public sealed abstract class FlowNode permits SequentialNode, ExitNode, ConditionNode {
    /// Marks an edge slot that has not been linked yet.
    protected static final int NO_NODE = -1;

    private final FlowGraph graph;
    private final int id;

    protected FlowNode(FlowGraph graph) {
        this.graph = graph;
        this.id = graph.register(this);
    }

    public final FlowGraph graph() {
        return this.graph;
    }

    public final int id() {
        return this.id;
    }

    /// All outgoing edges in a fixed order: the sequential successor, or the true branch before the false branch.
    public abstract List<FlowNode> successors();

    public abstract <T, R> R accept(FlowNodeVisitor<T, R> visitor, T data);

    /// Checks that `target` can be linked from this node and returns its id.
    protected final int linkTarget(FlowNode target) {
        if (target.graph() != this.graph) {
            throw new IllegalArgumentException(target + " does not belong to the graph of " + this);
        }
        return target.id();
    }

    @Override
    public String toString() {
        return (this.getClass().getSimpleName().replace("Node", "") + "#" + this.id + " " + info()).stripTrailing();
    }

    protected String info() {
        return "";
    }
}
