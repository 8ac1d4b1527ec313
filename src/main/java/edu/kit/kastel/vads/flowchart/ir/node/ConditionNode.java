package edu.kit.kastel.vads.flowchart.ir.node;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

/// A two-way branch on a target-language boolean expression. Each branch is linked exactly once.
public final class ConditionNode extends FlowNode {
    private final String condition;
    private int trueBranch = NO_NODE;
    private int falseBranch = NO_NODE;

    public ConditionNode(FlowGraph graph, String condition) {
        super(graph);
        this.condition = condition;
    }

    public String condition() {
        return this.condition;
    }

    public @Nullable FlowNode trueBranch() {
        return this.trueBranch == NO_NODE ? null : graph().node(this.trueBranch);
    }

    public @Nullable FlowNode falseBranch() {
        return this.falseBranch == NO_NODE ? null : graph().node(this.falseBranch);
    }

    public void setTrueBranch(FlowNode target) {
        if (this.trueBranch != NO_NODE) {
            throw new IllegalStateException("true branch of " + this + " is already linked");
        }
        this.trueBranch = linkTarget(target);
    }

    public void setFalseBranch(FlowNode target) {
        if (this.falseBranch != NO_NODE) {
            throw new IllegalStateException("false branch of " + this + " is already linked");
        }
        this.falseBranch = linkTarget(target);
    }

    @Override
    public List<FlowNode> successors() {
        List<FlowNode> successors = new ArrayList<>(2);
        FlowNode onTrue = trueBranch();
        FlowNode onFalse = falseBranch();
        if (onTrue != null) {
            successors.add(onTrue);
        }
        if (onFalse != null) {
            successors.add(onFalse);
        }
        return successors;
    }

    @Override
    public <T, R> R accept(FlowNodeVisitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    protected String info() {
        return this.condition;
    }
}
