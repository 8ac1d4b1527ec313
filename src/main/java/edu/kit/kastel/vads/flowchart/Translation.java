package edu.kit.kastel.vads.flowchart;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;

/// The result of a successful translation: the control-flow graph and the C code generated from it.
public record Translation(FlowGraph graph, String code) {
}
