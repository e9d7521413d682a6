package com.tmdledit.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tmdledit.errors.UnsupportedPropertyException;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.EntitySpec;
import com.tmdledit.models.PropertyChanges;
import com.tmdledit.models.PropertyKey;

import java.util.Iterator;

/**
 * Reads JSON entity specs and property changes into typed values.
 *
 * <p>Keys may use the snake_case payload names or common aliases ({@code formatString},
 * {@code hidden}, {@code measure_name}, dashed or spaced spellings). Any problem is reported as
 * an {@link UnsupportedPropertyException} whose detail names it, e.g. {@code unknown-arg:color}.
 */
public class PayloadParser {
    public static final String ERR_INVALID_FORMAT = "payload-invalid-format";

    private final ObjectMapper objectMapper;
    private final PayloadSchema measureSchema;
    private final PayloadSchema columnSchema;
    private final PayloadSchema changesSchema;

    public PayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.measureSchema = withAliases(new PayloadSchema("measure")
            .arg(PropertyKey.NAME, PayloadArgSpec.Type.LINE, true)
            .arg(PropertyKey.EXPRESSION, PayloadArgSpec.Type.TEXT, true)
            .arg(PropertyKey.FORMAT_STRING, PayloadArgSpec.Type.LINE, false)
            .arg(PropertyKey.IS_HIDDEN, PayloadArgSpec.Type.BOOLEAN, false)
            .arg(PropertyKey.DESCRIPTION, PayloadArgSpec.Type.TEXT, false))
            .alias("measure_name", "name")
            .alias("measurename", "name");
        this.columnSchema = withAliases(new PayloadSchema("column")
            .arg(PropertyKey.NAME, PayloadArgSpec.Type.LINE, true)
            .arg(PropertyKey.DATA_TYPE, PayloadArgSpec.Type.DATA_TYPE, false)
            .arg(PropertyKey.EXPRESSION, PayloadArgSpec.Type.TEXT, false)
            .arg(PropertyKey.FORMAT_STRING, PayloadArgSpec.Type.LINE, false)
            .arg(PropertyKey.SUMMARIZE_BY, PayloadArgSpec.Type.SUMMARIZE_BY, false)
            .arg(PropertyKey.IS_HIDDEN, PayloadArgSpec.Type.BOOLEAN, false)
            .arg(PropertyKey.DESCRIPTION, PayloadArgSpec.Type.TEXT, false))
            .alias("column_name", "name")
            .alias("columnname", "name");
        this.changesSchema = withAliases(new PayloadSchema("changes")
            .arg(PropertyKey.NAME, PayloadArgSpec.Type.LINE, false)
            .arg(PropertyKey.DATA_TYPE, PayloadArgSpec.Type.DATA_TYPE, false)
            .arg(PropertyKey.EXPRESSION, PayloadArgSpec.Type.TEXT, false)
            .arg(PropertyKey.FORMAT_STRING, PayloadArgSpec.Type.LINE, false)
            .arg(PropertyKey.SUMMARIZE_BY, PayloadArgSpec.Type.SUMMARIZE_BY, false)
            .arg(PropertyKey.IS_HIDDEN, PayloadArgSpec.Type.BOOLEAN, false)
            .arg(PropertyKey.DESCRIPTION, PayloadArgSpec.Type.TEXT, false))
            .alias("new_name", "name")
            .alias("measure_name", "name")
            .alias("column_name", "name");
    }

    private static PayloadSchema withAliases(PayloadSchema schema) {
        return schema
            .alias("formatstring", "format_string")
            .alias("format", "format_string")
            .alias("datatype", "data_type")
            .alias("type", "data_type")
            .alias("summarizeby", "summarize_by")
            .alias("ishidden", "is_hidden")
            .alias("hidden", "is_hidden")
            .alias("dax", "expression");
    }

    /**
     * Parses what to add. Only measures and columns have a payload shape.
     */
    public EntitySpec parseEntitySpec(EntityKind kind, String json) throws UnsupportedPropertyException {
        PayloadSchema schema;
        if (kind == EntityKind.MEASURE) {
            schema = measureSchema;
        } else if (kind == EntityKind.COLUMN) {
            schema = columnSchema;
        } else {
            String keyword = kind == null ? "null" : kind.getKeyword();
            throw new UnsupportedPropertyException("not-applicable:kind",
                "Only measures and columns can be added, not " + keyword);
        }
        JsonNode normalized = readAndValidate(schema, json);
        PropertyChanges properties = new PropertyChanges();
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            JsonNode value = normalized.get(field);
            if (!value.isNull()) {
                PayloadArgSpec spec = schema.getArgSpecs().get(field);
                properties.set(spec.getKey(), spec.convert(value));
            }
        }
        return new EntitySpec(kind, properties);
    }

    /**
     * Parses property changes. A JSON null clears the property.
     */
    public PropertyChanges parsePropertyChanges(String json) throws UnsupportedPropertyException {
        JsonNode normalized = readAndValidate(changesSchema, json);
        PropertyChanges changes = new PropertyChanges();
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            JsonNode value = normalized.get(field);
            PayloadArgSpec spec = changesSchema.getArgSpecs().get(field);
            changes.set(spec.getKey(), spec.convert(value));
        }
        if (changes.isEmpty()) {
            throw new UnsupportedPropertyException("missing-required:changes", "No property changes supplied");
        }
        return changes;
    }

    private JsonNode readAndValidate(PayloadSchema schema, String json) throws UnsupportedPropertyException {
        JsonNode node = readObject(json);
        JsonNode normalized = schema.normalizeArgsNode(node);
        String error = schema.validate(normalized);
        if (error != null) {
            throw new UnsupportedPropertyException(error, describe(error, schema.getSchemaId()));
        }
        return normalized;
    }

    private JsonNode readObject(String json) throws UnsupportedPropertyException {
        String trimmed = json == null ? "" : stripInvisibleEdgeChars(json.trim());
        if (trimmed.isEmpty()) {
            throw new UnsupportedPropertyException(ERR_INVALID_FORMAT, "Payload is empty");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            throw new UnsupportedPropertyException(ERR_INVALID_FORMAT,
                "Payload is not valid JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new UnsupportedPropertyException(ERR_INVALID_FORMAT, "Payload must be a JSON object");
        }
        return node;
    }

    private String describe(String detail, String schemaId) {
        int colon = detail.indexOf(':');
        String kind = colon < 0 ? detail : detail.substring(0, colon);
        String arg = colon < 0 ? "" : detail.substring(colon + 1);
        switch (kind) {
            case "unknown-arg":
                return "Unknown " + schemaId + " property '" + arg + "'";
            case "missing-required":
                return "Missing required " + schemaId + " property '" + arg + "'";
            case "invalid-type":
                return "Wrong value type for '" + arg + "'";
            case "invalid-enum":
                return "Unsupported value for '" + arg + "'";
            case "invalid-value":
                return "Value of '" + arg + "' must fit on one line";
            default:
                return "Invalid " + schemaId + " payload";
        }
    }

    private String stripInvisibleEdgeChars(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isInvisible(value.charAt(start))) {
            start++;
        }
        while (end > start && isInvisible(value.charAt(end - 1))) {
            end--;
        }
        if (start == 0 && end == value.length()) return value;
        return value.substring(start, end).trim();
    }

    private boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }
}
