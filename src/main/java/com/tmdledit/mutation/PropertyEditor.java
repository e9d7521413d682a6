package com.tmdledit.mutation;

import com.tmdledit.errors.DuplicateNameException;
import com.tmdledit.errors.UnsupportedPropertyException;
import com.tmdledit.models.DataType;
import com.tmdledit.models.Elements;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.PropertyKey;
import com.tmdledit.models.SummarizeBy;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies property changes to a single entity. Existing lines are replaced where they stand,
 * cleared lines are removed, and new lines go to their canonical position.
 */
class PropertyEditor {

    private static final Map<PropertyKey, Set<EntityKind>> APPLICABLE = Map.of(
        PropertyKey.EXPRESSION, EnumSet.of(EntityKind.MEASURE, EntityKind.COLUMN, EntityKind.CALCULATION_ITEM,
            EntityKind.ANNOTATION, EntityKind.PARTITION),
        PropertyKey.FORMAT_STRING, EnumSet.of(EntityKind.MEASURE, EntityKind.COLUMN),
        PropertyKey.DATA_TYPE, EnumSet.of(EntityKind.COLUMN),
        PropertyKey.SUMMARIZE_BY, EnumSet.of(EntityKind.COLUMN),
        PropertyKey.IS_HIDDEN, EnumSet.of(EntityKind.TABLE, EntityKind.COLUMN, EntityKind.MEASURE,
            EntityKind.HIERARCHY)
    );

    static boolean isApplicable(EntityKind kind, PropertyKey key) {
        if (key == PropertyKey.DESCRIPTION) {
            return true;
        }
        if (key == PropertyKey.NAME) {
            return kind.isNamed();
        }
        return APPLICABLE.get(key).contains(kind);
    }

    /**
     * Rejects the whole change set before anything is written.
     */
    void validate(TmdlEntity entity, PropertyChanges changes, String path) throws UnsupportedPropertyException {
        EntityKind kind = entity.getKind();
        for (PropertyKey key : changes.keys()) {
            if (!isApplicable(kind, key)) {
                throw new UnsupportedPropertyException("not-applicable:" + key.getPayloadKey(),
                    key.getPayloadKey() + " cannot be set on a " + kind.getKeyword(), path);
            }
            Object value = changes.get(key);
            boolean required = key == PropertyKey.NAME || key == PropertyKey.EXPRESSION;
            if (required && (value == null || value.toString().isBlank())) {
                throw new UnsupportedPropertyException("invalid-value:" + key.getPayloadKey(),
                    key.getPayloadKey() + " must not be empty on a " + kind.getKeyword(), path);
            }
            if (key == PropertyKey.NAME || key == PropertyKey.FORMAT_STRING) {
                checkSingleLine(key, value, path);
            }
            if (key == PropertyKey.EXPRESSION && kind == EntityKind.COLUMN && !entity.isCalculated()) {
                throw new UnsupportedPropertyException("not-applicable:expression",
                    "Column '" + entity.getName() + "' is a data column; add a calculated column instead", path);
            }
        }
    }

    /**
     * Names and {@code key: value} properties must fit on one line.
     */
    static void checkSingleLine(PropertyKey key, Object value, String path) throws UnsupportedPropertyException {
        if (value instanceof String && (((String) value).indexOf('\n') >= 0 || ((String) value).indexOf('\r') >= 0)) {
            throw new UnsupportedPropertyException("invalid-value:" + key.getPayloadKey(),
                key.getPayloadKey() + " must not contain line breaks", path);
        }
    }

    /**
     * @param siblings members of the entity's parent, for the rename duplicate check
     * @return payload keys of the changes applied
     */
    List<String> apply(TmdlEntity entity, PropertyChanges changes, List<TmdlElement> siblings, String path)
            throws UnsupportedPropertyException, DuplicateNameException {
        validate(entity, changes, path);
        if (changes.contains(PropertyKey.NAME)) {
            rename(entity, changes.getString(PropertyKey.NAME).strip(), siblings, path);
        }
        List<String> applied = applyValues(entity, changes, path);
        if (changes.contains(PropertyKey.NAME)) {
            applied.add(0, PropertyKey.NAME.getPayloadKey());
        }
        return applied;
    }

    /**
     * Applies every change except a rename.
     */
    List<String> applyValues(TmdlEntity entity, PropertyChanges changes, String path)
            throws UnsupportedPropertyException {
        validate(entity, changes, path);
        List<String> applied = new ArrayList<>();
        for (PropertyKey key : changes.keys()) {
            if (key == PropertyKey.NAME) {
                continue;
            }
            Object value = changes.get(key);
            switch (key) {
                case EXPRESSION:
                    setExpression(entity, (String) value);
                    break;
                case FORMAT_STRING:
                    setValue(entity, "formatString", (String) value);
                    break;
                case DATA_TYPE:
                    setValue(entity, "dataType", value == null ? null : ((DataType) value).toTmdl());
                    break;
                case SUMMARIZE_BY:
                    setValue(entity, "summarizeBy", value == null ? null : ((SummarizeBy) value).toTmdl());
                    break;
                case IS_HIDDEN:
                    setFlag(entity, "isHidden", Boolean.TRUE.equals(value));
                    break;
                case DESCRIPTION:
                    entity.setDescription((String) value);
                    break;
                default:
                    break;
            }
            applied.add(key.getPayloadKey());
        }
        return applied;
    }

    private void rename(TmdlEntity entity, String newName, List<TmdlElement> siblings, String path)
            throws DuplicateNameException {
        if (newName.equals(entity.getName())) {
            return;
        }
        for (TmdlEntity sibling : Elements.entities(siblings, entity.getKind())) {
            if (sibling != entity && newName.equalsIgnoreCase(sibling.getName())) {
                throw new DuplicateNameException(
                    "A " + entity.getKind().getKeyword() + " named '" + sibling.getName() + "' already exists", path);
            }
        }
        entity.setName(newName);
    }

    private void setExpression(TmdlEntity entity, String expression) {
        String normalized = normalizeExpression(expression);
        if (entity.getKind() == EntityKind.PARTITION) {
            TmdlProperty source = entity.findProperty("source");
            if (source != null) {
                if (!normalized.equals(source.getValue())) {
                    source.setValue(normalized);
                }
            } else {
                insert(entity, TmdlProperty.expression("source", normalized, entity.getDepth() + 1));
            }
            return;
        }
        if (!normalized.equals(entity.getExpression())) {
            entity.setExpression(normalized);
        }
    }

    void setValue(TmdlEntity entity, String key, String value) {
        TmdlProperty existing = entity.findProperty(key);
        if (value == null) {
            if (existing != null) {
                entity.getMembers().remove(existing);
            }
            return;
        }
        TmdlProperty replacement = TmdlProperty.colon(key, value, entity.getDepth() + 1);
        if (existing == null) {
            insert(entity, replacement);
        } else if (existing.getStyle() != TmdlProperty.Style.COLON || !value.equals(existing.getValue())) {
            replace(entity, existing, replacement);
        }
    }

    void setFlag(TmdlEntity entity, String key, boolean on) {
        TmdlProperty existing = entity.findProperty(key);
        if (!on) {
            if (existing != null) {
                entity.getMembers().remove(existing);
            }
            return;
        }
        if (existing == null) {
            insert(entity, TmdlProperty.flag(key, entity.getDepth() + 1));
        } else if (!existing.isTrue()) {
            replace(entity, existing, TmdlProperty.flag(key, entity.getDepth() + 1));
        }
    }

    private void insert(TmdlEntity entity, TmdlProperty property) {
        int index = CanonicalPropertyOrder.insertionIndex(entity, property.getKey());
        entity.getMembers().add(index, property);
    }

    private void replace(TmdlEntity entity, TmdlProperty existing, TmdlProperty replacement) {
        List<TmdlElement> members = entity.getMembers();
        members.set(members.indexOf(existing), replacement);
    }

    /**
     * Single-line text is trimmed. Multi-line text loses trailing whitespace on each line and
     * leading or trailing blank lines.
     */
    static String normalizeExpression(String expression) {
        if (expression == null) {
            return null;
        }
        String text = expression.replace("\r\n", "\n").replace('\r', '\n');
        if (text.indexOf('\n') < 0) {
            return text.strip();
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.stripTrailing());
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.size() == 1) {
            return lines.get(0).strip();
        }
        return String.join("\n", lines);
    }
}
