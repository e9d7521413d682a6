package com.tmdledit.models;

import com.tmdledit.writer.IdentifierQuoting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Address of an entity: a top-level segment (a table by default) followed by
 * {@code kind:name} segments, written {@code Date/hierarchy:'Date Hierarchy'/level:Month}.
 */
public final class EntityPath {

    public record Segment(EntityKind kind, String name) {
        @Override
        public String toString() {
            String quoted = name == null ? "" : IdentifierQuoting.quote(name);
            return kind.getKeyword() + ":" + quoted;
        }
    }

    private final List<Segment> segments;

    private EntityPath(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    public static EntityPath table(String tableName) {
        return new EntityPath(List.of(new Segment(EntityKind.TABLE, tableName)));
    }

    public static EntityPath of(EntityKind kind, String name) {
        return new EntityPath(List.of(new Segment(kind, name)));
    }

    public EntityPath child(EntityKind kind, String name) {
        List<Segment> next = new ArrayList<>(segments);
        next.add(new Segment(kind, name));
        return new EntityPath(next);
    }

    /**
     * Parses the textual form. The first segment may omit its kind, in which case it names a
     * table. Throws {@link IllegalArgumentException} on an empty path or an unknown kind.
     */
    public static EntityPath parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty entity path");
        }
        List<String> parts = splitOutsideQuotes(text.trim(), '/');
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i).trim();
            int colon = indexOutsideQuotes(part, ':');
            if (colon < 0) {
                if (i > 0) {
                    throw new IllegalArgumentException("Segment '" + part + "' needs a kind prefix, as in measure:Name");
                }
                segments.add(new Segment(EntityKind.TABLE, IdentifierQuoting.unquote(part)));
                continue;
            }
            EntityKind kind = EntityKind.parse(part.substring(0, colon));
            if (kind == null) {
                throw new IllegalArgumentException("Unknown entity kind in path segment '" + part + "'");
            }
            String name = part.substring(colon + 1).trim();
            segments.add(new Segment(kind, name.isEmpty() ? null : IdentifierQuoting.unquote(name)));
        }
        return new EntityPath(segments);
    }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public Segment getLast() {
        return segments.get(segments.size() - 1);
    }

    public EntityPath getParent() {
        if (segments.size() <= 1) {
            return null;
        }
        return new EntityPath(segments.subList(0, segments.size() - 1));
    }

    public String getTableName() {
        Segment first = segments.get(0);
        return first.kind() == EntityKind.TABLE ? first.name() : null;
    }

    private static List<String> splitOutsideQuotes(String text, char separator) {
        List<String> parts = new ArrayList<>();
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == separator && !quoted) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int indexOutsideQuotes(String text, char target) {
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == target && !quoted) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityPath)) return false;
        return segments.equals(((EntityPath) o).segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (i > 0) {
                sb.append('/');
                sb.append(segment);
            } else if (segment.kind() == EntityKind.TABLE) {
                sb.append(IdentifierQuoting.quote(segment.name()));
            } else {
                sb.append(segment);
            }
        }
        return sb.toString();
    }
}
