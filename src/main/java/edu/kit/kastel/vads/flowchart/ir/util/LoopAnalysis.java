package edu.kit.kastel.vads.flowchart.ir.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.ir.node.ConditionNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;
import edu.kit.kastel.vads.flowchart.ir.node.SequentialNode;

/// Finds the back-edges of a graph with a depth-first search from its entry.
///
/// An edge is a back-edge if it leads to a node that is still on the search stack. Graphs built from structured
/// programs have two shapes of back-edges:
///
/// - a statement jumping back to a condition: the condition is the head of a `while` or `for` loop,
/// - the false branch of a condition jumping back to the first node of a `repeat` body.
///
/// A `repeat` body may itself start with a loop, so several loops can share their first node.
public class LoopAnalysis {
    private final List<BackEdge> backEdges = new ArrayList<>();
    private final Set<EdgeKey> backEdgeKeys = new HashSet<>();
    private final BitSet preTestHeads = new BitSet();
    private final Map<FlowNode, List<ConditionNode>> postTestConditions = new HashMap<>();

    public record BackEdge(FlowNode source, FlowNode target, boolean falseBranch) {
    }

    private record EdgeKey(int source, int target) {
    }

    public void analyze(FlowGraph graph) {
        BitSet onStack = new BitSet(graph.size());
        BitSet discovered = new BitSet(graph.size());
        // iterative, so long statement chains cannot overflow the call stack
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(graph.entry()));
        discovered.set(graph.entry().id());
        onStack.set(graph.entry().id());
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.index < frame.successors.size()) {
                int index = frame.index++;
                FlowNode successor = frame.successors.get(index);
                if (onStack.get(successor.id())) {
                    recordBackEdge(frame.node, successor, frame.node instanceof ConditionNode && index == 1);
                } else if (!discovered.get(successor.id())) {
                    discovered.set(successor.id());
                    onStack.set(successor.id());
                    stack.push(new Frame(successor));
                }
            } else {
                stack.pop();
                onStack.clear(frame.node.id());
            }
        }
    }

    private void recordBackEdge(FlowNode source, FlowNode target, boolean falseBranch) {
        this.backEdges.add(new BackEdge(source, target, falseBranch));
        this.backEdgeKeys.add(new EdgeKey(source.id(), target.id()));
        if (source instanceof SequentialNode && target instanceof ConditionNode) {
            this.preTestHeads.set(target.id());
        } else if (falseBranch) {
            // true branches are searched first, so an enclosing repeat is found before the ones it encloses
            this.postTestConditions.computeIfAbsent(target, head -> new ArrayList<>()).add((ConditionNode) source);
        }
    }

    public List<BackEdge> backEdges() {
        return Collections.unmodifiableList(this.backEdges);
    }

    public boolean isBackEdge(FlowNode source, FlowNode target) {
        return this.backEdgeKeys.contains(new EdgeKey(source.id(), target.id()));
    }

    /// Whether the condition is tested before each iteration, as in `while` and `for`.
    public boolean isPreTestLoop(ConditionNode condition) {
        return this.preTestHeads.get(condition.id());
    }

    /// The conditions ending the `repeat` loops that start at `head`, outermost loop first.
    /// Empty if no `repeat` loop starts there.
    public List<ConditionNode> postTestConditions(FlowNode head) {
        return Collections.unmodifiableList(this.postTestConditions.getOrDefault(head, List.of()));
    }

    private static final class Frame {
        private final FlowNode node;
        private final List<FlowNode> successors;
        private int index;

        Frame(FlowNode node) {
            this.node = node;
            this.successors = node.successors();
        }
    }
}
