package com.tmdledit.writer;

import com.tmdledit.models.EntityKind;

import java.util.Locale;

/**
 * Quoting of object names and property values. Names are single-quoted only when an unquoted
 * form would be read differently; values of {@code key: value} lines are double-quoted only when
 * whitespace or an empty value would otherwise be lost.
 */
public final class IdentifierQuoting {

    private static final String RESERVED = ".=:'\"[](){},;/\\#@-+*&|<>!?^%$~`";

    private IdentifierQuoting() {
    }

    public static boolean needsQuoting(String name) {
        if (name == null || name.isEmpty()) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || RESERVED.indexOf(c) >= 0) {
                return true;
            }
        }
        return isKeyword(name);
    }

    public static boolean isKeyword(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (EntityKind kind : EntityKind.values()) {
            if (kind.getKeyword().toLowerCase(Locale.ROOT).equals(lower)) {
                return true;
            }
        }
        return false;
    }

    public static String quote(String name) {
        String value = name == null ? "" : name;
        if (!needsQuoting(value)) {
            return value;
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Logical name of a raw token. Unquoted tokens are returned trimmed.
     */
    public static String unquote(String raw) {
        if (raw == null) {
            return null;
        }
        String token = raw.trim();
        if (token.length() >= 2 && token.startsWith("'") && token.endsWith("'")) {
            return token.substring(1, token.length() - 1).replace("''", "'");
        }
        return token;
    }

    /**
     * Length of the name token at the start of {@code text}: a single-quoted run (with
     * doubled quotes inside) or everything up to whitespace or {@code =}. Returns 0 when the
     * text does not start with a name.
     */
    public static int nameTokenLength(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        if (text.charAt(0) == '\'') {
            int i = 1;
            while (i < text.length()) {
                if (text.charAt(i) == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i += 2;
                        continue;
                    }
                    return i + 1;
                }
                i++;
            }
            return text.length();
        }
        int i = 0;
        while (i < text.length() && !Character.isWhitespace(text.charAt(i)) && text.charAt(i) != '=') {
            i++;
        }
        return i;
    }

    public static String quoteValue(String value) {
        if (value == null || value.isEmpty()) {
            return "\"\"";
        }
        boolean padded = !value.equals(value.strip());
        if (padded || value.startsWith("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    public static String unquoteValue(String raw) {
        if (raw == null) {
            return null;
        }
        String token = raw.strip();
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            return token.substring(1, token.length() - 1).replace("\"\"", "\"");
        }
        return token;
    }
}
