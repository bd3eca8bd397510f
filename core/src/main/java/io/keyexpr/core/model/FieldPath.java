package io.keyexpr.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.keyexpr.core.parse.FieldPathParser;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Path to a (possibly) nested field in a JSON document, for example {@code nested.field}, or
 * {@code another.`not.nested`.field} when a field name itself contains a period.
 *
 * <p>Syntax:
 *
 * <ul>
 *   <li>nested fields are separated by {@code .}
 *   <li>{@code `} encloses an exact name, so {@code `a.b`} is one field called {@code a.b}
 *   <li>{@code ``} stands for a single literal backtick, inside or outside an enclosed name
 * </ul>
 *
 * <p>Examples: {@code key} is {@code [key]}; {@code nested.key} is {@code [nested, key]}; {@code
 * `not.a.nested`.key} is {@code [not.a.nested, key]}; {@code ```.key`} is {@code [`.key]}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param segments field names from the outermost object inwards
 */
public record FieldPath(List<String> segments) {

    public static final char PERIOD = '.';
    public static final char BACKTICK = '`';

    public FieldPath {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parses a field path expression.
     *
     * @throws io.keyexpr.core.error.FieldPathException if the path is malformed
     */
    public static FieldPath parse(String path) {
        return new FieldPath(FieldPathParser.parse(path));
    }

    /** Creates a path from already-split segment names. */
    public static FieldPath of(String... segments) {
        return new FieldPath(List.of(segments));
    }

    /** Number of nesting levels. */
    public int depth() {
        return segments.size();
    }

    /** The innermost field name. */
    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    /**
     * Removes this path from the given document map if it exists. Intermediate levels that are
     * missing or not maps leave the document untouched.
     */
    @SuppressWarnings("unchecked")
    public void removeFrom(Map<String, Object> document) {
        Map<String, Object> current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            Object value = current.get(segments.get(i));
            if (!(value instanceof Map)) {
                return;
            }
            current = (Map<String, Object>) value;
        }
        current.remove(leaf());
    }

    /** Same as {@link #removeFrom(Map)} for a Jackson tree. */
    public void removeFrom(ObjectNode document) {
        ObjectNode current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode value = current.get(segments.get(i));
            if (value == null || !value.isObject()) {
                return;
            }
            current = (ObjectNode) value;
        }
        current.remove(leaf());
    }

    /**
     * Renders this path in field path syntax. Backticks are doubled and names containing a period
     * are enclosed in backticks, so {@code parse(p.toExpression())} equals {@code p}.
     *
     * @throws IllegalStateException if a segment is empty (not expressible in the syntax)
     */
    public String toExpression() {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalStateException("empty field name can not be expressed: " + segments);
            }
            if (sb.length() > 0) {
                sb.append(PERIOD);
            }
            String escaped = segment.replace("`", "``");
            if (segment.indexOf(PERIOD) >= 0) {
                sb.append(BACKTICK).append(escaped).append(BACKTICK);
            } else {
                sb.append(escaped);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
