package com.tmdledit.mutation;

import com.tmdledit.errors.UnsupportedPropertyException;
import com.tmdledit.models.DataType;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.PropertyKey;
import com.tmdledit.models.TmdlEntity;

/**
 * Builds new measures and columns with their property lines in canonical order.
 */
class EntityFactory {

    private final PropertyEditor editor;

    EntityFactory(PropertyEditor editor) {
        this.editor = editor;
    }

    TmdlEntity create(EntitySpec spec, int depth, String lineageTag, String path)
            throws UnsupportedPropertyException {
        EntityKind kind = spec.getKind();
        if (kind != EntityKind.MEASURE && kind != EntityKind.COLUMN) {
            throw new UnsupportedPropertyException("not-applicable:kind",
                "Only measures and columns can be added, not " + kind.getKeyword(), path);
        }
        String name = spec.getName();
        if (name == null || name.isBlank()) {
            throw new UnsupportedPropertyException("missing-required:name", "A name is required", path);
        }
        PropertyEditor.checkSingleLine(PropertyKey.NAME, name, path);
        PropertyChanges properties = spec.getProperties();
        String expression = properties.getString(PropertyKey.EXPRESSION);
        if (kind == EntityKind.MEASURE && (expression == null || expression.isBlank())) {
            throw new UnsupportedPropertyException("missing-required:expression",
                "Measure '" + name + "' needs an expression", path);
        }

        TmdlEntity entity = TmdlEntity.create(kind, name.strip(), depth);
        if (expression != null && !expression.isBlank()) {
            entity.setExpression(PropertyEditor.normalizeExpression(expression));
        }

        PropertyChanges rest = new PropertyChanges();
        for (PropertyKey key : properties.keys()) {
            if (key != PropertyKey.NAME && key != PropertyKey.EXPRESSION && properties.get(key) != null) {
                rest.set(key, properties.get(key));
            }
        }
        if (kind == EntityKind.COLUMN && !rest.contains(PropertyKey.DATA_TYPE)) {
            rest.dataType(DataType.STRING);
        }
        editor.applyValues(entity, rest, path);

        editor.setValue(entity, "lineageTag", lineageTag);
        if (kind == EntityKind.COLUMN && !entity.isCalculated()) {
            editor.setValue(entity, "sourceColumn", entity.getName());
        }
        return entity;
    }
}
