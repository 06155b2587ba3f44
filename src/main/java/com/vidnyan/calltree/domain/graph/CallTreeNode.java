package com.vidnyan.calltree.domain.graph;

import com.vidnyan.calltree.domain.model.CallEdge;
import com.vidnyan.calltree.domain.model.FunctionRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One function occurrence in a call tree. A name can appear in several branches.
 */
public final class CallTreeNode {

    private final String name;
    private final int depth;
    private final CallEdge via;
    private final FunctionRecord definition;
    private final boolean recursive;
    private boolean truncated;
    private final List<CallTreeNode> children = new ArrayList<>();

    CallTreeNode(String name, int depth, CallEdge via, FunctionRecord definition, boolean recursive) {
        this.name = name;
        this.depth = depth;
        this.via = via;
        this.definition = definition;
        this.recursive = recursive;
    }

    public String name() {
        return name;
    }

    public int depth() {
        return depth;
    }

    /**
     * Edge from the parent, null for the root.
     */
    public CallEdge via() {
        return via;
    }

    /**
     * First definition of the function, null if it has no body in the scanned sources.
     */
    public FunctionRecord definition() {
        return definition;
    }

    /**
     * The function is already on the path from the root; not expanded further.
     */
    public boolean isRecursive() {
        return recursive;
    }

    /**
     * The function has calls that were cut off by the depth limit.
     */
    public boolean isTruncated() {
        return truncated;
    }

    public boolean isDefined() {
        return definition != null;
    }

    public List<CallTreeNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    void addChild(CallTreeNode child) {
        children.add(child);
    }

    void markTruncated() {
        this.truncated = true;
    }

    @Override
    public String toString() {
        return name + "@" + depth + (recursive ? " [RECURSIVE]" : "") + (truncated ? " [TRUNCATED]" : "");
    }
}
