package edu.kit.kastel.vads.flowchart.ir;

import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;
import edu.kit.kastel.vads.flowchart.ir.node.OperationNode;

/// A partially built piece of a graph: control enters at `entry` and, after zero or more nodes, leaves
/// at `exit`. The exit is always an operation node, so a successor can be appended to it.
public record ControlFlowFragment(FlowNode entry, OperationNode exit) {
}
