package edu.kit.kastel.vads.flowchart.ir.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.flowchart.ir.node.ConditionNode;
import edu.kit.kastel.vads.flowchart.ir.node.FlowNode;
import edu.kit.kastel.vads.flowchart.ir.node.OperationNode;

/// Graph queries for consumers that only hold a node of the graph, such as a flowchart renderer.
public final class NodeSupport {
    private NodeSupport() {

    }

    /// All nodes reachable from `start`, `start` first, true branches before false branches.
    public static Set<FlowNode> reachable(FlowNode start) {
        Set<FlowNode> seen = new LinkedHashSet<>();
        Deque<FlowNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            FlowNode node = stack.pop();
            if (!seen.add(node)) {
                continue;
            }
            List<FlowNode> successors = node.successors();
            for (int i = successors.size() - 1; i >= 0; i--) {
                stack.push(successors.get(i));
            }
        }
        return seen;
    }

    /// Whether the node is a sentinel, recognized by its payload text alone.
    public static boolean isMarker(FlowNode node) {
        return node instanceof OperationNode operation && operation.isMarker();
    }

    /// Follows a chain of markers to the first node that is not one.
    /// Returns `null` if the chain ends or runs in a circle before reaching such a node.
    public static @Nullable FlowNode skipMarkers(@Nullable FlowNode node) {
        Set<FlowNode> seen = new HashSet<>();
        FlowNode current = node;
        while (current != null && isMarker(current)) {
            if (!seen.add(current)) {
                return null;
            }
            current = ((OperationNode) current).next();
        }
        return current;
    }

    /// Flowchart heuristic for loop heads: some node reachable from the true branch leads back to the condition.
    ///
    /// A condition nested inside a loop body also reaches itself through the enclosing loop, so it is reported as
    /// well. [LoopAnalysis] tells loop heads apart exactly.
    public static boolean isLoopCondition(ConditionNode condition) {
        FlowNode start = skipMarkers(condition.trueBranch());
        if (start == null) {
            return false;
        }
        return reachable(start).contains(condition);
    }
}
