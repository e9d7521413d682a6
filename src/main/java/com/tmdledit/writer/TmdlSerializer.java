package com.tmdledit.writer;

import com.tmdledit.models.OpaqueBlock;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;
import com.tmdledit.models.Trivia;
import com.tmdledit.parser.IndentUnit;

import java.util.List;

/**
 * Writes a document back to text. Untouched elements are copied from their source lines;
 * edited and new elements are rendered with the document's indent unit and line terminator.
 */
public class TmdlSerializer {

    public String serialize(TmdlDocument document) {
        Output out = new Output(document.getNewline(), document.getIndentUnit());
        for (TmdlElement element : document.getElements()) {
            emit(element, out);
        }
        return out.toString();
    }

    private void emit(TmdlElement element, Output out) {
        if (element instanceof TmdlEntity) {
            emitEntity((TmdlEntity) element, out);
        } else if (element instanceof TmdlProperty) {
            emitProperty((TmdlProperty) element, out);
        } else if (element instanceof OpaqueBlock) {
            out.raw(((OpaqueBlock) element).getRawLines());
        } else if (element instanceof Trivia) {
            emitTrivia((Trivia) element, out);
        }
    }

    private void emitEntity(TmdlEntity entity, Output out) {
        for (Trivia line : entity.getDescriptionLines()) {
            emitTrivia(line, out);
        }
        if (!entity.isDeclarationModified() && entity.getDeclarationRaw() != null) {
            out.raw(entity.getDeclarationRaw());
        } else {
            emitDeclaration(entity, out);
        }
        for (TmdlElement member : entity.getMembers()) {
            emit(member, out);
        }
    }

    private void emitDeclaration(TmdlEntity entity, Output out) {
        String header = out.indent(entity.getDepth()) + entity.getKind().getKeyword()
            + (entity.getRawName() == null ? "" : " " + entity.getRawName());
        if (!entity.hasExpression()) {
            out.line(header);
        } else if (!entity.isExpressionModified() && entity.getDeclarationRaw() != null) {
            // renamed only: keep the authored expression lines
            String inline = entity.getInlineExpression();
            out.line(inline.isEmpty() ? header + " =" : header + " = " + inline);
            out.raw(entity.getDeclarationContinuation());
        } else {
            emitExpression(header, entity.getExpression(), entity.getDepth(), out);
        }
    }

    private void emitProperty(TmdlProperty property, Output out) {
        if (!property.isModified()) {
            out.raw(property.getRawLines());
            return;
        }
        String prefix = out.indent(property.getDepth()) + property.getKey();
        switch (property.getStyle()) {
            case COLON:
                out.line(prefix + ": " + IdentifierQuoting.quoteValue(property.getValue()));
                break;
            case EQUALS:
                emitExpression(prefix, property.getValue(), property.getDepth(), out);
                break;
            default:
                out.line(property.getValue() == null ? prefix : prefix + " " + property.getValue());
                break;
        }
    }

    /**
     * Single-line text stays on the header; multi-line text starts on the next line,
     * two units deeper than the header.
     */
    private void emitExpression(String header, String expression, int depth, Output out) {
        if (expression == null || expression.isEmpty()) {
            out.line(header + " =");
            return;
        }
        if (expression.indexOf('\n') < 0) {
            out.line(header + " = " + expression);
            return;
        }
        out.line(header + " =");
        String bodyIndent = out.indent(depth + 2);
        for (String line : expression.split("\n", -1)) {
            out.line(line.isEmpty() ? "" : bodyIndent + line);
        }
    }

    private void emitTrivia(Trivia trivia, Output out) {
        if (!trivia.isModified()) {
            out.raw(trivia.getRawLines());
        } else if (trivia.isBlank()) {
            out.line("");
        } else {
            out.line(out.indent(trivia.getDepth()) + trivia.getText());
        }
    }

    private static final class Output {
        private final StringBuilder sb = new StringBuilder();
        private final String newline;
        private final IndentUnit unit;

        Output(String newline, IndentUnit unit) {
            this.newline = newline;
            this.unit = unit;
        }

        String indent(int depth) {
            return unit.repeat(depth);
        }

        void raw(List<String> rawLines) {
            if (rawLines.isEmpty()) {
                return;
            }
            terminate();
            for (String raw : rawLines) {
                sb.append(raw);
            }
        }

        void line(String text) {
            terminate();
            sb.append(text).append(newline);
        }

        // the source's last line may lack a terminator; anything written after it needs one
        private void terminate() {
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
                sb.append(newline);
            }
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}
