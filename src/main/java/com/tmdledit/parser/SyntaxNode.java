package com.tmdledit.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the indentation tree. The root has no line and depth -1.
 */
public final class SyntaxNode {

    private final LogicalLine line;
    private final int depth;
    private final List<SyntaxNode> children = new ArrayList<>();

    SyntaxNode(LogicalLine line, int depth) {
        this.line = line;
        this.depth = depth;
    }

    static SyntaxNode root() {
        return new SyntaxNode(null, -1);
    }

    public LogicalLine getLine() {
        return line;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isRoot() {
        return line == null;
    }

    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasStatementChildren() {
        for (SyntaxNode child : children) {
            if (!child.line.isTrivia()) {
                return true;
            }
        }
        return false;
    }

    void addChild(SyntaxNode child) {
        children.add(child);
    }

    /**
     * Raw lines of this node and its whole subtree, in source order.
     */
    public List<String> collectRawLines() {
        List<String> raws = new ArrayList<>();
        collect(this, raws);
        return raws;
    }

    private static void collect(SyntaxNode node, List<String> raws) {
        if (node.line != null) {
            raws.addAll(node.line.getRawLines());
        }
        for (SyntaxNode child : node.children) {
            collect(child, raws);
        }
    }
}
