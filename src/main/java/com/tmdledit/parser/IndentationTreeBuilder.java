package com.tmdledit.parser;

import com.tmdledit.errors.MalformedIndentationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the ordered indentation tree in one left-to-right pass. Trivia lines (blank, comment,
 * description) are held back and attached to the parent of the next statement, just before it;
 * trivia after the last statement hangs off the root.
 */
public class IndentationTreeBuilder {

    public SyntaxNode build(List<LogicalLine> lines) throws MalformedIndentationException {
        SyntaxNode root = SyntaxNode.root();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        List<LogicalLine> pending = new ArrayList<>();

        for (LogicalLine line : lines) {
            if (line.isTrivia()) {
                pending.add(line);
                continue;
            }
            int depth = line.getDepth();
            while (!stack.isEmpty() && stack.peek().getDepth() >= depth) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                throw new MalformedIndentationException("Line dedents past the document root", line.getLineNumber());
            }
            SyntaxNode parent = stack.peek();
            if (parent.getDepth() != depth - 1) {
                throw new MalformedIndentationException(
                    "Depth " + depth + " does not continue any open block", line.getLineNumber());
            }
            for (LogicalLine trivia : pending) {
                parent.addChild(new SyntaxNode(trivia, depth));
            }
            pending.clear();
            SyntaxNode node = new SyntaxNode(line, depth);
            parent.addChild(node);
            stack.push(node);
        }
        for (LogicalLine trivia : pending) {
            root.addChild(new SyntaxNode(trivia, 0));
        }
        return root;
    }
}
