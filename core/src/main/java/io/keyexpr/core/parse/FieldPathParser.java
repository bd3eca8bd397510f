package io.keyexpr.core.parse;

import static io.keyexpr.core.model.FieldPath.BACKTICK;
import static io.keyexpr.core.model.FieldPath.PERIOD;

import io.keyexpr.core.error.FieldPathException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a field path such as {@code nested.`with.dot`.key} into its segment names.
 *
 * <p>Each segment is read with a two-state scanner. Outside backticks a period ends the segment, a
 * single backtick opens an enclosed name and a doubled backtick is a literal backtick. Inside
 * backticks a single backtick closes the name and a doubled one is again a literal.
 *
 * <p>Thread-safe and stateless.
 */
public final class FieldPathParser {

    private FieldPathParser() {}

    /**
     * Parses the given path into segment names.
     *
     * @throws FieldPathException if the path is empty, starts with a period, contains an empty
     *     nested name or has unbalanced backticks
     */
    public static List<String> parse(String path) {
        if (path == null || path.isEmpty()) {
            throw new FieldPathException("cannot find field without name", path);
        }
        if (path.charAt(0) == PERIOD) {
            throw new FieldPathException("cannot find nested object of field without name", path);
        }

        List<String> segments = new ArrayList<>();
        int idx = 0;
        while (idx < path.length()) {
            idx = parseSegment(path, idx, segments);
        }
        return segments;
    }

    /** Parses one segment starting at {@code start}; returns the index after its terminator. */
    private static int parseSegment(String path, int start, List<String> segments) {
        StringBuilder segment = new StringBuilder();
        boolean open = false;
        int idx = start;

        while (idx < path.length()) {
            char c = path.charAt(idx);

            if (open) {
                if (c != BACKTICK) {
                    segment.append(c);
                    idx++;
                } else if (ExpressionScanner.peek(path, idx) == BACKTICK) {
                    segment.append(BACKTICK);
                    idx += 2;
                } else {
                    open = false;
                    idx++;
                }
                continue;
            }

            if (c == PERIOD) {
                if (path.charAt(idx - 1) == PERIOD) {
                    throw new FieldPathException("empty field name", path);
                }
                break;
            }

            if (c != BACKTICK) {
                segment.append(c);
                idx++;
            } else if (ExpressionScanner.peek(path, idx) == BACKTICK) {
                segment.append(BACKTICK);
                idx += 2;
            } else {
                open = true;
                idx++;
            }
        }

        if (open) {
            throw new FieldPathException("unbalanced backticks", path);
        }

        segments.add(segment.toString());
        return idx + 1;
    }
}
