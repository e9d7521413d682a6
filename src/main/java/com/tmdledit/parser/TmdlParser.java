package com.tmdledit.parser;

import com.tmdledit.errors.TmdlParseException;
import com.tmdledit.models.TmdlDocument;

import java.util.List;

/**
 * Segment, build the indentation tree, map to entities.
 */
public class TmdlParser {

    private final LineSegmenter segmenter = new LineSegmenter();
    private final IndentationTreeBuilder treeBuilder = new IndentationTreeBuilder();
    private final EntityMapper mapper = new EntityMapper();

    public TmdlDocument parse(String text) throws TmdlParseException {
        List<String> physical = LineSegmenter.splitPhysicalLines(text);
        IndentUnit unit = IndentUnit.detect(physical);
        List<LogicalLine> lines = segmenter.segment(physical, unit);
        SyntaxNode root = treeBuilder.build(lines);
        return mapper.map(root, LineSegmenter.detectNewline(physical), unit);
    }
}
