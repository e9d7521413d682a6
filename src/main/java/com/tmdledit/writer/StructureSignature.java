package com.tmdledit.writer;

import com.tmdledit.models.OpaqueBlock;
import com.tmdledit.models.TmdlDocument;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;
import com.tmdledit.models.Trivia;

import java.util.List;

/**
 * Canonical string describing a document's structure: kinds, names, expressions, descriptions,
 * properties, opaque text and trivia in order. Two documents with equal signatures are
 * structurally the same regardless of how their text was produced.
 */
public final class StructureSignature {

    private StructureSignature() {
    }

    public static String of(TmdlDocument document) {
        StringBuilder sb = new StringBuilder();
        append(document.getElements(), sb);
        return sb.toString();
    }

    private static void append(List<TmdlElement> elements, StringBuilder sb) {
        for (TmdlElement element : elements) {
            if (element instanceof TmdlEntity) {
                TmdlEntity entity = (TmdlEntity) element;
                sb.append("E[").append(entity.getKind().getKeyword())
                    .append('|').append(entity.getName())
                    .append('|').append(entity.getExpression())
                    .append('|').append(entity.getDescription())
                    .append("]{");
                append(entity.getMembers(), sb);
                sb.append('}');
            } else if (element instanceof TmdlProperty) {
                TmdlProperty property = (TmdlProperty) element;
                sb.append("P[").append(property.getKey())
                    .append('|').append(property.getStyle())
                    .append('|').append(property.getValue())
                    .append(']');
            } else if (element instanceof OpaqueBlock) {
                sb.append("O[").append(((OpaqueBlock) element).getRawText().strip()).append(']');
            } else if (element instanceof Trivia) {
                Trivia trivia = (Trivia) element;
                sb.append("T[").append(trivia.getType()).append('|').append(trivia.getText()).append(']');
            }
            sb.append('\n');
        }
    }
}
