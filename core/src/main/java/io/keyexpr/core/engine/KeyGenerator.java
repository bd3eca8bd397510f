package io.keyexpr.core.engine;

import io.keyexpr.core.error.KeyResultException;
import io.keyexpr.core.model.Delimiters;
import io.keyexpr.core.spi.DocumentLookup;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * A compiled key expression: an ordered list of {@link Generator}s whose fragments are
 * concatenated into a document key. Built by {@link io.keyexpr.core.parse.KeyExpressionCompiler}
 * and meant to be reused for every document of an import.
 *
 * <p>Example expressions with the default delimiters, for a document {@code {"key": "value1",
 * "nested": {"key": "value2"}}}:
 *
 * <ul>
 *   <li>{@code key::#MONO_INCR#} gives {@code key::1}, {@code key::2}, ...
 *   <li>{@code user-#UUID#} gives {@code user-e0837e46-0d48-45e3-92e7-28031170d23d}, ...
 *   <li>{@code %nested.key%::#MONO_INCR[50]#} gives {@code value2::50}, {@code value2::51}, ...
 * </ul>
 *
 * <p><strong>Not thread-safe.</strong> {@code MONO_INCR} counters are mutated on every call, so
 * concurrent calls to {@link #next} on one instance must be serialized by the caller, for example
 * with one generator per worker or an external lock.
 */
public final class KeyGenerator {

    /** Maximum size in bytes of a generated key. */
    public static final int MAX_KEY_SIZE = 250;

    private final String expression;
    private final Delimiters delimiters;
    private final List<Generator> generators;
    private final DocumentLookup lookup;

    public KeyGenerator(String expression, Delimiters delimiters, List<Generator> generators, DocumentLookup lookup) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.delimiters = Objects.requireNonNull(delimiters, "delimiters must not be null");
        this.generators = List.copyOf(generators);
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    /**
     * Generates the key for the given document.
     *
     * @param document raw JSON document
     * @return the UTF-8 key, between 1 and {@value #MAX_KEY_SIZE} bytes
     * @throws KeyResultException if a generator fails or the key is empty or too large
     */
    public byte[] next(byte[] document) {
        DocumentLookup documentLookup = lookup.forDocument(document);
        StringBuilder buffer = new StringBuilder();
        for (Generator generator : generators) {
            buffer.append(generator.next(document, documentLookup));
        }

        byte[] key = buffer.toString().getBytes(StandardCharsets.UTF_8);
        if (key.length == 0) {
            throw new KeyResultException("generated key is an empty string");
        }
        if (key.length > MAX_KEY_SIZE) {
            throw new KeyResultException(String.format("generated key is larger than %d bytes", MAX_KEY_SIZE));
        }
        return key;
    }

    /** The expression this generator was compiled from. */
    public String expression() {
        return expression;
    }

    /** The delimiters the expression was compiled with. */
    public Delimiters delimiters() {
        return delimiters;
    }

    /** Unmodifiable view of the compiled generators, in expression order. */
    public List<Generator> generators() {
        return generators;
    }

    /** Number of compiled generators. */
    public int size() {
        return generators.size();
    }

    @Override
    public String toString() {
        return "KeyGenerator[expression=" + expression + ", generators=" + generators + "]";
    }
}
