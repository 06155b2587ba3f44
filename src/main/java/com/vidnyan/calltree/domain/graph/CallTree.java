package com.vidnyan.calltree.domain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-limited expansion of the call graph from one root function.
 */
public record CallTree(CallTreeNode root, int maxDepth, boolean includeRte, TreeStats stats) {

    /**
     * @param totalNodes     nodes in the tree, root included
     * @param uniqueFunctions distinct function names in the tree
     * @param maxDepthReached deepest node's depth
     * @param totalCalls     edges followed (nodes minus the root)
     * @param recursiveCalls nodes cut because their function was already on the path
     * @param truncatedNodes nodes cut by the depth limit
     */
    public record TreeStats(
        int totalNodes,
        int uniqueFunctions,
        int maxDepthReached,
        int totalCalls,
        int recursiveCalls,
        int truncatedNodes
    ) {}

    /**
     * All nodes in pre-order.
     */
    public List<CallTreeNode> nodes() {
        List<CallTreeNode> out = new ArrayList<>();
        Deque<CallTreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CallTreeNode node = stack.pop();
            out.add(node);
            List<CallTreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    public Set<String> functionNames() {
        Set<String> names = new LinkedHashSet<>();
        for (CallTreeNode node : nodes()) {
            names.add(node.name());
        }
        return names;
    }

    public List<CallTreeNode> leaves() {
        return nodes().stream().filter(CallTreeNode::isLeaf).toList();
    }
}
