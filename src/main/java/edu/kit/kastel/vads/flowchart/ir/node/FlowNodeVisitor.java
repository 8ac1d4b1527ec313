package edu.kit.kastel.vads.flowchart.ir.node;

/// Dispatches over the closed set of node kinds.
///
/// @param <T> the type of the context data
/// @param <R> the type of the return value
public interface FlowNodeVisitor<T, R> {
    R visit(EntryNode entryNode, T data);

    R visit(ExitNode exitNode, T data);

    R visit(OperationNode operationNode, T data);

    R visit(ConditionNode conditionNode, T data);
}
