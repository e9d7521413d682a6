package com.tmdledit.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdledit.models.PropertyKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Accepted keys of one payload shape, with aliases mapped onto canonical key names.
 */
public class PayloadSchema {
    private final String schemaId;
    private final Map<String, PayloadArgSpec> args = new LinkedHashMap<>();
    // Alias -> canonical arg name
    private final Map<String, String> argAliases = new LinkedHashMap<>();

    public PayloadSchema(String schemaId) {
        this.schemaId = schemaId;
    }

    public PayloadSchema arg(PropertyKey key, PayloadArgSpec.Type type, boolean required) {
        args.put(key.getPayloadKey(), new PayloadArgSpec(key, type, required));
        return this;
    }

    public PayloadSchema alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
            return this;
        }
        argAliases.put(normalizeArgKey(alias), canonical);
        return this;
    }

    public String getSchemaId() {
        return schemaId;
    }

    public Map<String, PayloadArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    /**
     * Copy of the payload with keys trimmed and aliases replaced by canonical names.
     * Keys that match nothing are left for {@link #validate(JsonNode)} to report.
     */
    public JsonNode normalizeArgsNode(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return argsNode;
        }
        ObjectNode obj = ((ObjectNode) argsNode).deepCopy();

        List<String> keys = new ArrayList<>();
        Iterator<String> it = obj.fieldNames();
        while (it.hasNext()) {
            keys.add(it.next());
        }
        for (String key : keys) {
            if (args.containsKey(key)) continue;

            String norm = normalizeArgKey(key);
            String canonical;
            if (args.containsKey(norm)) {
                canonical = norm;
            } else {
                canonical = argAliases.get(norm);
            }
            if (canonical == null || canonical.isBlank()) {
                continue;
            }
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private String normalizeArgKey(String key) {
        if (key == null) return "";
        String k = key.trim().toLowerCase(Locale.ROOT);
        if (k.isEmpty()) return "";
        // Unify common separators.
        k = k.replace('-', '_').replace(' ', '_');
        return k;
    }

    /**
     * Detail code of the first problem found in an already normalized payload, or null.
     */
    public String validate(JsonNode normalized) {
        if (normalized == null || !normalized.isObject()) {
            return PayloadParser.ERR_INVALID_FORMAT;
        }
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field.trim();
            }
        }
        for (PayloadArgSpec spec : args.values()) {
            String error = spec.validate(normalized.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        return null;
    }
}
