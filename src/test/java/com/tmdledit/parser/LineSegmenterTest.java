package com.tmdledit.parser;

import com.tmdledit.errors.MalformedIndentationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineSegmenterTest {

    private final LineSegmenter segmenter = new LineSegmenter();

    @Test
    void classifiesTriviaAndStatements() throws Exception {
        String text = "/// Orders\ntable Fact\n\n\t// kept\n\tlineageTag: abc\n";
        List<LogicalLine> lines = segmenter.segment(text);

        assertEquals(5, lines.size());
        assertEquals(LogicalLine.Kind.DESCRIPTION, lines.get(0).getKind());
        assertEquals(LogicalLine.Kind.STATEMENT, lines.get(1).getKind());
        assertEquals(LogicalLine.Kind.BLANK, lines.get(2).getKind());
        assertEquals(LogicalLine.Kind.COMMENT, lines.get(3).getKind());
        assertEquals(1, lines.get(3).getDepth());
        assertEquals("lineageTag: abc", lines.get(4).getContent());
        assertEquals(5, lines.get(4).getLineNumber());
    }

    @Test
    void deeperLinesContinueAnExpression() throws Exception {
        String text = "table T\n"
            + "\tmeasure X =\n"
            + "\t\t\tVAR a = 1\n"
            + "\n"
            + "\t\t\tRETURN a\n"
            + "\t\tformatString: 0\n";
        List<LogicalLine> lines = segmenter.segment(text);

        assertEquals(3, lines.size());
        LogicalLine measure = lines.get(1);
        assertEquals(4, measure.getRawLines().size());
        assertEquals("\n", measure.getRawLines().get(2));
        assertEquals("formatString: 0", lines.get(2).getContent());
        assertEquals(6, lines.get(2).getLineNumber());
    }

    @Test
    void blankLinesAfterAnExpressionStayOutsideIt() throws Exception {
        String text = "table T\n\tmeasure X =\n\t\t\t1\n\n\tmeasure Y = 2\n";
        List<LogicalLine> lines = segmenter.segment(text);

        assertEquals(2, lines.get(1).getRawLines().size());
        assertEquals(LogicalLine.Kind.BLANK, lines.get(2).getKind());
        assertEquals("measure Y = 2", lines.get(3).getContent());
    }

    @Test
    void openBracketsContinueOneLevelDeeper() throws Exception {
        String text = "table T\n"
            + "\tmeasure X = CALCULATE(\n"
            + "\t\tSUM(T[a]),\n"
            + "\t\tT[b] > 0\n"
            + "\t\t)\n"
            + "\t\tformatString: 0\n";
        List<LogicalLine> lines = segmenter.segment(text);

        assertEquals(3, lines.size());
        assertEquals(4, lines.get(1).getRawLines().size());
        assertEquals(2, lines.get(2).getDepth());
    }

    @Test
    void fencedExpressionRunsToClosingFence() throws Exception {
        String text = "table T\n"
            + "\tmeasure X = ```\n"
            + "\tVAR a = 1\n"
            + "RETURN a\n"
            + "\t\t\t```\n"
            + "\t\tlineageTag: t1\n";
        List<LogicalLine> lines = segmenter.segment(text);

        assertEquals(3, lines.size());
        assertEquals(4, lines.get(1).getRawLines().size());
        assertEquals("lineageTag: t1", lines.get(2).getContent());
    }

    @Test
    void unterminatedFenceIsRejected() {
        String text = "table T\n\tmeasure X = ```\n\t\t\t1\n";
        MalformedIndentationException e = assertThrows(MalformedIndentationException.class,
            () -> segmenter.segment(text));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void skippedIndentLevelIsRejected() {
        String text = "table T\n\t\t\tcolumn C\n";
        MalformedIndentationException e = assertThrows(MalformedIndentationException.class,
            () -> segmenter.segment(text));
        assertEquals(2, e.getLineNumber());
        assertTrue(e.getMessage().startsWith("Line 2: "));
    }

    @Test
    void separatorIgnoresQuotedText() {
        assertEquals(13, LineSegmenter.findSeparator("column 'a:b' = 1"));
        assertEquals(10, LineSegmenter.findSeparator("lineageTag: x=y"));
        assertEquals(-1, LineSegmenter.findSeparator("isHidden"));
    }

    @Test
    void bracketBalanceSkipsStringsAndComments() {
        assertEquals(1, LineSegmenter.bracketBalance("CALCULATE("));
        assertEquals(0, LineSegmenter.bracketBalance("\"(\" & T[a]"));
        assertEquals(0, LineSegmenter.bracketBalance("1 // (unbalanced"));
        assertEquals(0, LineSegmenter.bracketBalance("'Odd (name'[col]"));
    }

    @Test
    void physicalLinesKeepTerminators() {
        List<String> lines = LineSegmenter.splitPhysicalLines("a\r\nb\nc");
        assertEquals(List.of("a\r\n", "b\n", "c"), lines);
        assertEquals("\r\n", LineSegmenter.detectNewline(lines));
        assertTrue(LineSegmenter.splitPhysicalLines("").isEmpty());
    }

    @Test
    void detectsSpaceIndentation() throws Exception {
        String text = "table T\n    column C\n        dataType: string\n";
        IndentUnit unit = IndentUnit.detect(LineSegmenter.splitPhysicalLines(text));
        assertEquals(IndentUnit.spaces(4), unit);

        List<LogicalLine> lines = segmenter.segment(text);
        assertEquals(2, lines.get(2).getDepth());
    }
}
