package edu.kit.kastel.vads.flowchart.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.node.EntryNode;
import edu.kit.kastel.vads.flowchart.ir.node.ExitNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;

/// The control-flow graph of one program: an arena owning all nodes.
///
/// Node ids are handed out by the graph itself, starting at `0`, and are indices into [#nodes()]. Loops make the
/// graph cyclic; since all nodes are owned here, the whole graph is released together.
public class FlowGraph {
    private final List<FlowNode> nodes = new ArrayList<>();
    private final String name;
    private @Nullable EntryNode entry;
    private @Nullable ExitNode exit;

    public FlowGraph(String name) {
        this.name = name;
    }

    /// Called by the node constructors. Returns the id of the new node.
    public int register(FlowNode node) {
        if (node.graph() != this) {
            throw new IllegalArgumentException("node " + node.getClass().getSimpleName() + " belongs to another graph");
        }
        if (node instanceof EntryNode entryNode) {
            if (this.entry != null) {
                throw new IllegalStateException("graph " + this.name + " already has an entry");
            }
            this.entry = entryNode;
        } else if (node instanceof ExitNode exitNode) {
            if (this.exit != null) {
                throw new IllegalStateException("graph " + this.name + " already has an exit");
            }
            this.exit = exitNode;
        }
        this.nodes.add(node);
        return this.nodes.size() - 1;
    }

    public FlowNode node(int id) {
        return this.nodes.get(id);
    }

    public List<FlowNode> nodes() {
        return Collections.unmodifiableList(this.nodes);
    }

    public int size() {
        return this.nodes.size();
    }

    public EntryNode entry() {
        if (this.entry == null) {
            throw new IllegalStateException("graph " + this.name + " has no entry yet");
        }
        return this.entry;
    }

    public ExitNode exit() {
        if (this.exit == null) {
            throw new IllegalStateException("graph " + this.name + " has no exit yet");
        }
        return this.exit;
    }

    public String name() {
        return this.name;
    }

    @Override
    public String toString() {
        return "FlowGraph[" + this.name + ", " + this.nodes.size() + " nodes]";
    }
}
