package com.vidnyan.calltree.domain.graph;

import com.vidnyan.calltree.domain.model.FunctionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Expands a {@link CallGraph} into a tree rooted at one function.
 * <p>
 * A callee already on the path from the root becomes a recursive leaf. Nodes at
 * the depth limit are not expanded and are marked truncated if they have calls.
 * Uses an explicit stack, so deep trees do not grow the Java stack.
 */
@Slf4j
public final class CallTreeBuilder {

    private static final class Frame {
        private final CallTreeNode treeNode;
        private final CallGraph.Node graphNode;
        private int nextEdge;

        private Frame(CallTreeNode treeNode, CallGraph.Node graphNode) {
            this.treeNode = treeNode;
            this.graphNode = graphNode;
        }
    }

    private CallTreeBuilder() {
    }

    /**
     * @throws NoSuchElementException if {@code root} is not a node of the graph
     */
    public static CallTree build(CallGraph graph, String root, int maxDepth, boolean includeRte) {
        if (root == null || root.isBlank()) {
            throw new IllegalArgumentException("Root function name must not be blank");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        CallGraph.Node rootNode = graph.node(root)
                .orElseThrow(() -> new NoSuchElementException("Function '" + root + "' not found"));
        log.info("Building call tree for {} (max depth {}, RTE calls {})",
                root, maxDepth, includeRte ? "included" : "excluded");

        CallTreeNode treeRoot = new CallTreeNode(rootNode.name(), 0, null, firstDefinition(rootNode), false);
        Set<String> onPath = new HashSet<>();
        Set<String> unique = new LinkedHashSet<>();
        int[] counters = new int[4]; // nodes, maxDepth, recursive, truncated
        counters[0] = 1;
        unique.add(rootNode.name());

        Deque<Frame> stack = new ArrayDeque<>();
        onPath.add(rootNode.name());
        stack.push(new Frame(treeRoot, rootNode));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            CallTreeNode parent = frame.treeNode;
            List<CallGraph.Edge> edges = frame.graphNode.outgoing();
            int next = frame.nextEdge;

            if (parent.depth() >= maxDepth) {
                if (hasFollowableEdge(edges, includeRte)) {
                    parent.markTruncated();
                    counters[3]++;
                }
                pop(stack, onPath, parent);
                continue;
            }
            if (next >= edges.size()) {
                pop(stack, onPath, parent);
                continue;
            }
            frame.nextEdge = next + 1;

            CallGraph.Edge edge = edges.get(next);
            if (edge.call().rte() && !includeRte) {
                continue;
            }
            CallGraph.Node target = graph.node(edge.to());
            boolean recursive = onPath.contains(target.name());
            CallTreeNode child = new CallTreeNode(target.name(), parent.depth() + 1, edge.call(),
                    firstDefinition(target), recursive);
            parent.addChild(child);
            counters[0]++;
            counters[1] = Math.max(counters[1], child.depth());
            unique.add(target.name());

            if (recursive) {
                counters[2]++;
                log.debug("Recursive call {} -> {} at depth {}", parent.name(), target.name(), child.depth());
            } else {
                onPath.add(target.name());
                stack.push(new Frame(child, target));
            }
        }

        CallTree.TreeStats stats = new CallTree.TreeStats(
                counters[0], unique.size(), counters[1], counters[0] - 1, counters[2], counters[3]);
        log.info("Call tree complete: {} nodes, {} unique functions, depth {}",
                stats.totalNodes(), stats.uniqueFunctions(), stats.maxDepthReached());
        return new CallTree(treeRoot, maxDepth, includeRte, stats);
    }

    private static boolean hasFollowableEdge(List<CallGraph.Edge> edges, boolean includeRte) {
        return edges.stream().anyMatch(e -> includeRte || !e.call().rte());
    }

    private static void pop(Deque<Frame> stack, Set<String> onPath, CallTreeNode node) {
        stack.pop();
        onPath.remove(node.name());
    }

    private static FunctionRecord firstDefinition(CallGraph.Node node) {
        return node.definitions().isEmpty() ? null : node.definitions().get(0);
    }
}
