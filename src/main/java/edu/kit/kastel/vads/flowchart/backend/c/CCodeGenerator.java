package edu.kit.kastel.vads.flowchart.backend.c;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.ir.node.ConditionNode;
import edu.kit.kastel.vads.flowchart.ir.node.EntryNode;
import edu.kit.kastel.vads.flowchart.ir.node.ExitNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNodeVisitor;
import edu.kit.kastel.vads.flowchart.ir.node.OperationNode;
import edu.kit.kastel.vads.flowchart.ir.util.LoopAnalysis;
import edu.kit.kastel.vads.flowchart.ir.util.NodeSupport;

/// Turns a [FlowGraph] back into C source.
///
/// The graph is walked depth-first from its entry. Every node is emitted at most once, which is what makes the
/// walk terminate on loops. A condition's true branch and false branch each become a block; the node where both
/// branches meet again is emitted after the closing brace, so code following a conditional stays behind it.
public class CCodeGenerator {
    private static final String INDENT = "    ";

    private final LoopStyle loopStyle;

    public CCodeGenerator() {
        this(LoopStyle.IF_ELSE);
    }

    public CCodeGenerator(LoopStyle loopStyle) {
        this.loopStyle = loopStyle;
    }

    public String generateCode(FlowGraph graph) {
        Emission emission = new Emission(graph);
        emission.emit("#include <stdio.h>");
        emission.emit("");
        emission.emit("int main() {");
        emission.indent++;
        emission.walk(graph.entry(), Set.of());
        emission.emit("return 0;");
        emission.indent--;
        emission.emit("}");
        return String.join("\n", emission.lines);
    }

    /// State of a single run, so one generator can serve any number of graphs.
    private final class Emission implements FlowNodeVisitor<Set<FlowNode>, @Nullable FlowNode> {
        private final List<String> lines = new ArrayList<>();
        private final BitSet visited;
        private final @Nullable LoopAnalysis loops;
        private final Set<ConditionNode> openedRepeats = new HashSet<>();
        private int indent;

        Emission(FlowGraph graph) {
            this.visited = new BitSet(graph.size());
            if (loopStyle == LoopStyle.STRUCTURED) {
                this.loops = new LoopAnalysis();
                this.loops.analyze(graph);
            } else {
                this.loops = null;
            }
        }

        void emit(String line) {
            this.lines.add(line.isEmpty() ? line : INDENT.repeat(this.indent) + line);
        }

        /// Emits the chain starting at `start` until it ends, reaches an emitted node or reaches a node of `stop`.
        void walk(@Nullable FlowNode start, Set<FlowNode> stop) {
            FlowNode node = start;
            while (node != null && !stop.contains(node) && !this.visited.get(node.id())) {
                ConditionNode repeatCondition = openingRepeat(node);
                if (repeatCondition != null) {
                    node = emitRepeat(node, repeatCondition, stop);
                    continue;
                }
                this.visited.set(node.id());
                node = node.accept(this, stop);
            }
        }

        @Override
        public @Nullable FlowNode visit(EntryNode entryNode, Set<FlowNode> stop) {
            return entryNode.next();
        }

        @Override
        public @Nullable FlowNode visit(ExitNode exitNode, Set<FlowNode> stop) {
            return null;
        }

        @Override
        public @Nullable FlowNode visit(OperationNode operationNode, Set<FlowNode> stop) {
            emit(operationNode.code());
            return operationNode.next();
        }

        @Override
        public @Nullable FlowNode visit(ConditionNode conditionNode, Set<FlowNode> stop) {
            if (this.loops != null && this.loops.isPreTestLoop(conditionNode)) {
                emit("while (" + conditionNode.condition() + ") {");
                this.indent++;
                walk(conditionNode.trueBranch(), stop);
                this.indent--;
                emit("}");
                return conditionNode.falseBranch();
            }
            FlowNode join = findJoin(conditionNode, stop);
            Set<FlowNode> inner = join == null ? stop : with(stop, join);
            emit("if (" + conditionNode.condition() + ") {");
            this.indent++;
            walk(conditionNode.trueBranch(), inner);
            this.indent--;
            FlowNode falseBranch = conditionNode.falseBranch();
            if (falseBranch != null) {
                emit("} else {");
                this.indent++;
                if (falseBranch == join && NodeSupport.isMarker(join)) {
                    // no else part in the source: the join marker is all there is to show
                    this.visited.set(join.id());
                    emit(((OperationNode) join).code());
                    this.indent--;
                    emit("}");
                    return ((OperationNode) join).next();
                }
                walk(falseBranch, inner);
                this.indent--;
            }
            emit("}");
            return join;
        }

        /// The outermost `repeat` loop starting at `node` that is not opened yet. Nested loops sharing their first
        /// node are opened one after the other, each inside the previous one.
        private @Nullable ConditionNode openingRepeat(FlowNode node) {
            if (this.loops == null) {
                return null;
            }
            for (ConditionNode condition : this.loops.postTestConditions(node)) {
                if (!this.openedRepeats.contains(condition)) {
                    return condition;
                }
            }
            return null;
        }

        private @Nullable FlowNode emitRepeat(FlowNode head, ConditionNode condition, Set<FlowNode> stop) {
            this.openedRepeats.add(condition);
            emit("do {");
            this.indent++;
            walk(head, with(stop, condition));
            this.indent--;
            this.visited.set(condition.id());
            emit("} while (!(" + condition.condition() + "));");
            return condition.trueBranch();
        }

        /// The first node on the true side that the false side reaches as well, searching only nodes that are not
        /// emitted yet and never passing the condition itself or a node of `stop`.
        private @Nullable FlowNode findJoin(ConditionNode condition, Set<FlowNode> stop) {
            Set<FlowNode> falseSide = region(condition.falseBranch(), condition, stop);
            if (falseSide.isEmpty()) {
                return null;
            }
            Set<FlowNode> seen = new HashSet<>();
            Deque<FlowNode> queue = new ArrayDeque<>();
            enqueue(queue, seen, condition.trueBranch(), condition, stop);
            while (!queue.isEmpty()) {
                FlowNode node = queue.poll();
                if (falseSide.contains(node)) {
                    return node;
                }
                for (FlowNode successor : node.successors()) {
                    enqueue(queue, seen, successor, condition, stop);
                }
            }
            return null;
        }

        private Set<FlowNode> region(@Nullable FlowNode start, ConditionNode condition, Set<FlowNode> stop) {
            Set<FlowNode> seen = new HashSet<>();
            Deque<FlowNode> queue = new ArrayDeque<>();
            enqueue(queue, seen, start, condition, stop);
            while (!queue.isEmpty()) {
                for (FlowNode successor : queue.poll().successors()) {
                    enqueue(queue, seen, successor, condition, stop);
                }
            }
            return seen;
        }

        private void enqueue(
            Deque<FlowNode> queue,
            Set<FlowNode> seen,
            @Nullable FlowNode node,
            ConditionNode condition,
            Set<FlowNode> stop
        ) {
            if (node == null || node == condition || stop.contains(node) || this.visited.get(node.id())) {
                return;
            }
            if (seen.add(node)) {
                queue.add(node);
            }
        }

        private Set<FlowNode> with(Set<FlowNode> stop, FlowNode node) {
            Set<FlowNode> extended = new HashSet<>(stop);
            extended.add(node);
            return extended;
        }
    }
}
