package edu.kit.kastel.vads.flowchart.ir.util;

import java.util.List;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.ir.node.ConditionNode;
import edu.kit.kastel.vads.flowchart.ir.node.EntryNode;
import edu.kit.kastel.vads.flowchart.ir.node.ExitNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNodeVisitor;
import edu.kit.kastel.vads.flowchart.ir.node.OperationNode;

/// Prints a [FlowGraph] in the GraphViz dot format, shaped like a flowchart.
/// Back-edges are dashed and do not take part in ranking, so loops flow downwards.
public class GraphVizPrinter {
    private final FlowGraph graph;
    private final LoopAnalysis loops = new LoopAnalysis();
    private final StringBuilder builder = new StringBuilder();

    private GraphVizPrinter(FlowGraph graph) {
        this.graph = graph;
    }

    public static String print(FlowGraph graph) {
        GraphVizPrinter printer = new GraphVizPrinter(graph);
        printer.loops.analyze(graph);
        printer.prettyPrint();
        return printer.builder.toString();
    }

    private void prettyPrint() {
        this.builder.append("digraph \"").append(escape(this.graph.name())).append("\" {\n");
        this.builder.append("    node [fontname=\"monospace\"];\n");
        for (FlowNode node : NodeSupport.reachable(this.graph.entry())) {
            this.builder.append("    ").append(name(node)).append(" [")
                .append(node.accept(NodeAttributes.INSTANCE, null))
                .append("];\n");
        }
        for (FlowNode node : NodeSupport.reachable(this.graph.entry())) {
            List<FlowNode> successors = node.successors();
            for (int i = 0; i < successors.size(); i++) {
                FlowNode successor = successors.get(i);
                this.builder.append("    ").append(name(node)).append(" -> ").append(name(successor));
                String attributes = edgeAttributes(node, successor, i);
                if (!attributes.isEmpty()) {
                    this.builder.append(" [").append(attributes).append("]");
                }
                this.builder.append(";\n");
            }
        }
        this.builder.append("}\n");
    }

    private String edgeAttributes(FlowNode source, FlowNode target, int index) {
        StringBuilder attributes = new StringBuilder();
        if (source instanceof ConditionNode) {
            attributes.append("label=\"").append(index == 0 ? "T" : "F").append("\"");
        }
        if (this.loops.isBackEdge(source, target)) {
            if (attributes.length() > 0) {
                attributes.append(", ");
            }
            attributes.append("style=dashed, constraint=false");
        }
        return attributes.toString();
    }

    private static String name(FlowNode node) {
        return "n" + node.id();
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private enum NodeAttributes implements FlowNodeVisitor<Void, String> {
        INSTANCE;

        @Override
        public String visit(EntryNode entryNode, Void data) {
            return "label=\"START\", shape=oval";
        }

        @Override
        public String visit(ExitNode exitNode, Void data) {
            return "label=\"END\", shape=oval";
        }

        @Override
        public String visit(OperationNode operationNode, Void data) {
            String label = "label=\"" + escape(operationNode.code()) + "\"";
            if (operationNode.isMarker()) {
                return label + ", shape=box, style=dashed, fontcolor=gray";
            }
            return label + ", shape=box";
        }

        @Override
        public String visit(ConditionNode conditionNode, Void data) {
            return "label=\"" + escape(conditionNode.condition()) + "\", shape=diamond";
        }
    }
}
