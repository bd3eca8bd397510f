package io.keyexpr.core.parse;

import io.keyexpr.core.config.KeyGenConfig;
import io.keyexpr.core.engine.Generator;
import io.keyexpr.core.engine.KeyGenerator;
import io.keyexpr.core.engine.jackson.JacksonDocumentLookup;
import io.keyexpr.core.error.EmptyExpressionException;
import io.keyexpr.core.error.KeyExpressionException;
import io.keyexpr.core.model.Delimiters;
import io.keyexpr.core.model.FieldPath;
import io.keyexpr.core.spi.DocumentLookup;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles key expressions into {@link KeyGenerator}s.
 *
 * <p>An expression is scanned left to right. At each position the scanner starts one of:
 *
 * <ul>
 *   <li>a field reference, {@code %path%}, parsed with {@link FieldPathParser}
 *   <li>a built-in generator, {@code #MONO_INCR#}, {@code #MONO_INCR[N]#} or {@code #UUID#}
 *   <li>literal text, up to the next delimiter that is not doubled
 * </ul>
 *
 * <p>Doubling a delimiter ({@code %%}, {@code ##}) yields one literal occurrence of it, both in
 * text and inside a field reference.
 *
 * <p>Thread-safe; every compiled {@link KeyGenerator} shares this compiler's {@link
 * DocumentLookup}.
 */
public final class KeyExpressionCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(KeyExpressionCompiler.class);

    /** {@code MONO_INCR} with an optional {@code [start]} suffix. */
    private static final Pattern MONO_INCR_PATTERN = Pattern.compile("^MONO_INCR(\\[(-?\\d+)\\])?$");

    private static final String UUID_TOKEN = "UUID";

    private final DocumentLookup lookup;

    /** Creates a compiler resolving fields with {@link JacksonDocumentLookup}. */
    public KeyExpressionCompiler() {
        this(new JacksonDocumentLookup());
    }

    public KeyExpressionCompiler(DocumentLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    /**
     * Compiles an expression with the given delimiters. The delimiters are validated before the
     * expression is looked at.
     *
     * @throws io.keyexpr.core.error.InvalidDelimiterException if the delimiters are unusable
     * @throws KeyExpressionException if the expression is empty or malformed
     * @throws io.keyexpr.core.error.FieldPathException if a field reference is malformed
     */
    public KeyGenerator compile(String expression, char fieldDelimiter, char generatorDelimiter) {
        return compile(expression, new Delimiters(fieldDelimiter, generatorDelimiter));
    }

    /** Compiles the expression and delimiters held by a configuration. */
    public KeyGenerator compile(KeyGenConfig config) {
        return compile(config.expression(), config.delimiters());
    }

    /** Compiles an expression with an already validated delimiter pair. */
    public KeyGenerator compile(String expression, Delimiters delimiters) {
        Objects.requireNonNull(delimiters, "delimiters must not be null");
        if (expression == null || expression.isEmpty()) {
            throw new EmptyExpressionException();
        }

        List<Generator> generators = new ArrayList<>();
        int idx = 0;
        while (idx < expression.length()) {
            idx = parseNext(expression, idx, delimiters, generators);
        }

        LOG.debug("Compiled key expression '{}' into {} generator(s)", expression, generators.size());
        return new KeyGenerator(expression, delimiters, generators, lookup);
    }

    /** Parses the unit starting at {@code idx}; returns the index just after it. */
    private static int parseNext(String exp, int idx, Delimiters delimiters, List<Generator> out) {
        if (ExpressionScanner.opensReference(exp, idx, delimiters.field())) {
            return parseField(exp, idx + 1, delimiters.field(), out);
        }
        if (ExpressionScanner.opensReference(exp, idx, delimiters.generator())) {
            return parseGenerator(exp, idx + 1, delimiters, out);
        }
        return parseText(exp, idx, delimiters, out);
    }

    /** Parses a field reference whose body starts at {@code start}. */
    private static int parseField(String exp, int start, char fieldDelimiter, List<Generator> out) {
        int idx = start;
        while (idx < exp.length()) {
            if (exp.charAt(idx) != fieldDelimiter) {
                idx++;
                continue;
            }
            // doubled delimiter, part of the field name
            if (ExpressionScanner.peek(exp, idx) == fieldDelimiter) {
                idx += 2;
                continue;
            }

            String path = ExpressionScanner.unescape(exp.substring(start, idx), fieldDelimiter);
            out.add(new Generator.Field(FieldPath.parse(path)));
            return idx + 1;
        }

        throw new KeyExpressionException(idx, "unclosed field at end of expression");
    }

    /** Parses a built-in generator token whose name starts at {@code start}. */
    private static int parseGenerator(String exp, int start, Delimiters delimiters, List<Generator> out) {
        int idx = start;
        while (idx < exp.length() && exp.charAt(idx) != delimiters.generator()) {
            if (exp.charAt(idx) == delimiters.field()) {
                throw new KeyExpressionException(idx, "attempting to start a field inside a generator");
            }
            idx++;
        }

        if (idx >= exp.length()) {
            throw new KeyExpressionException(idx, "unclosed generator at end of expression");
        }

        out.add(createGenerator(exp.substring(start, idx), start));
        return idx + 1;
    }

    /** Maps a generator token to its implementation. */
    private static Generator createGenerator(String token, int start) {
        Matcher monoIncr = MONO_INCR_PATTERN.matcher(token);
        if (monoIncr.matches()) {
            return createMonoIncr(monoIncr.group(2), start);
        }
        if (UUID_TOKEN.equals(token)) {
            return new Generator.Uuid();
        }
        throw new KeyExpressionException(start, "invalid generator");
    }

    private static Generator.MonoIncr createMonoIncr(String startPoint, int start) {
        if (startPoint == null) {
            return new Generator.MonoIncr();
        }

        long value;
        try {
            value = Long.parseLong(startPoint);
        } catch (NumberFormatException e) {
            throw new KeyExpressionException(start, "failed to parse MONO_INCR start point '" + startPoint + "'");
        }

        if (value <= 0) {
            LOG.warn(
                    "MONO_INCR start point {} is not positive, counting from {}",
                    value,
                    Generator.MonoIncr.DEFAULT_START);
        }
        return new Generator.MonoIncr(value);
    }

    /** Parses literal text starting at {@code start}, stopping before the next field/generator. */
    private static int parseText(String exp, int start, Delimiters delimiters, List<Generator> out) {
        char fieldDelimiter = delimiters.field();
        char generatorDelimiter = delimiters.generator();
        int idx = start;

        while (idx < exp.length()) {
            char c = exp.charAt(idx);
            if (c != fieldDelimiter && c != generatorDelimiter) {
                idx++;
                continue;
            }

            int next = ExpressionScanner.peek(exp, idx);
            if (next == ExpressionScanner.NONE) {
                throw new KeyExpressionException(
                        idx + 1, ExpressionScanner.startAtEndReason(c, generatorDelimiter));
            }
            if (next != c) {
                break;
            }
            idx += 2;
        }

        String text = ExpressionScanner.unescape(exp.substring(start, idx), fieldDelimiter, generatorDelimiter);
        out.add(new Generator.Text(text));
        return idx;
    }
}
