package com.tmdledit.parser;

import com.tmdledit.AppLogger;
import com.tmdledit.errors.TmdlParseException;
import com.tmdledit.errors.UnknownEntityKeywordException;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.OpaqueBlock;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;
import com.tmdledit.models.Trivia;
import com.tmdledit.writer.IdentifierQuoting;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns an indentation tree into typed document elements.
 *
 * <p>A line is an entity when its first token is an entity keyword not followed by {@code :}.
 * Other lines are properties; a property that owns nested lines is kept as an opaque block.
 * At the top level only entity keywords and the model-file keywords in
 * {@link #OPAQUE_TOP_LEVEL_KEYWORDS} are accepted.
 */
public class EntityMapper {

    public static final Set<String> OPAQUE_TOP_LEVEL_KEYWORDS = Set.of(
        "model", "database", "cultureInfo", "expression", "role", "perspective", "dataSource",
        "queryGroup", "ref", "createOrReplace", "function"
    );

    public TmdlDocument map(SyntaxNode root, String newline, IndentUnit unit) throws TmdlParseException {
        List<TmdlElement> elements = mapMembers(root.getChildren(), unit, true);
        return new TmdlDocument(elements, newline, unit);
    }

    private List<TmdlElement> mapMembers(List<SyntaxNode> nodes, IndentUnit unit, boolean topLevel)
            throws TmdlParseException {
        List<TmdlElement> members = new ArrayList<>();
        for (SyntaxNode node : nodes) {
            LogicalLine line = node.getLine();
            if (line.isTrivia()) {
                members.add(toTrivia(line, node.getDepth()));
                continue;
            }
            TmdlElement element = mapStatement(node, unit, topLevel);
            if (element instanceof TmdlEntity) {
                attachDescription((TmdlEntity) element, members);
            }
            members.add(element);
        }
        return members;
    }

    private TmdlElement mapStatement(SyntaxNode node, IndentUnit unit, boolean topLevel) throws TmdlParseException {
        LogicalLine line = node.getLine();
        String content = line.getContent();
        String keyword = firstToken(content);
        String rest = content.substring(keyword.length()).strip();
        EntityKind kind = EntityKind.fromKeyword(keyword);

        if (kind != null && !rest.startsWith(":")) {
            return mapEntity(node, kind, rest, unit);
        }
        if (topLevel) {
            if (OPAQUE_TOP_LEVEL_KEYWORDS.contains(keyword)) {
                return new OpaqueBlock(keyword, line.getDepth(), line.getLineNumber(), node.collectRawLines());
            }
            throw new UnknownEntityKeywordException(keyword, line.getLineNumber());
        }
        if (node.hasStatementChildren()) {
            log("Keeping nested block '" + keyword + "' at line " + line.getLineNumber() + " verbatim");
            return new OpaqueBlock(keyword, line.getDepth(), line.getLineNumber(), node.collectRawLines());
        }
        return mapProperty(line, unit);
    }

    private TmdlEntity mapEntity(SyntaxNode node, EntityKind kind, String rest, IndentUnit unit)
            throws TmdlParseException {
        LogicalLine line = node.getLine();
        String name = null;
        String rawName = null;
        String after = rest;
        if (kind.isNamed()) {
            int length = IdentifierQuoting.nameTokenLength(rest);
            rawName = rest.substring(0, length);
            name = IdentifierQuoting.unquote(rawName);
            after = rest.substring(length).strip();
        }

        String expression = null;
        String inline = null;
        if (after.startsWith("=")) {
            inline = after.substring(1).strip();
            expression = ExpressionText.extract(line, unit, inline);
        }

        TmdlEntity entity = new TmdlEntity(kind, name, rawName, expression, inline,
            line.getDepth(), line.getLineNumber(), line.getRawLines());
        entity.getMembers().addAll(mapMembers(node.getChildren(), unit, false));
        return entity;
    }

    private TmdlProperty mapProperty(LogicalLine line, IndentUnit unit) {
        String content = line.getContent();
        int separator = LineSegmenter.findSeparator(content);
        if (separator < 0) {
            return new TmdlProperty(content, TmdlProperty.Style.FLAG, null,
                line.getDepth(), line.getLineNumber(), line.getRawLines());
        }
        String key = content.substring(0, separator).strip();
        String valueText = content.substring(separator + 1).strip();
        if (content.charAt(separator) == ':') {
            return new TmdlProperty(key, TmdlProperty.Style.COLON, IdentifierQuoting.unquoteValue(valueText),
                line.getDepth(), line.getLineNumber(), line.getRawLines());
        }
        return new TmdlProperty(key, TmdlProperty.Style.EQUALS, ExpressionText.extract(line, unit, valueText),
            line.getDepth(), line.getLineNumber(), line.getRawLines());
    }

    /**
     * Moves the {@code ///} lines directly above an entity from the member list into the entity.
     */
    private void attachDescription(TmdlEntity entity, List<TmdlElement> members) {
        int start = members.size();
        while (start > 0) {
            TmdlElement previous = members.get(start - 1);
            if (!(previous instanceof Trivia) || ((Trivia) previous).getType() != Trivia.Type.DESCRIPTION) {
                break;
            }
            start--;
        }
        List<TmdlElement> descriptionLines = members.subList(start, members.size());
        for (TmdlElement element : descriptionLines) {
            entity.addDescriptionLine((Trivia) element);
        }
        descriptionLines.clear();
    }

    private Trivia toTrivia(LogicalLine line, int depth) {
        Trivia.Type type;
        switch (line.getKind()) {
            case BLANK:
                type = Trivia.Type.BLANK;
                break;
            case DESCRIPTION:
                type = Trivia.Type.DESCRIPTION;
                break;
            default:
                type = Trivia.Type.COMMENT;
                break;
        }
        return new Trivia(type, line.getContent(), depth, line.getLineNumber(), line.getRawLines());
    }

    static String firstToken(String content) {
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (Character.isWhitespace(c) || c == ':' || c == '=') {
                break;
            }
            i++;
        }
        return content.substring(0, i);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[EntityMapper] " + message);
        }
    }
}
