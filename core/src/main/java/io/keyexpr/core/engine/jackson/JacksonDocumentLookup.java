package io.keyexpr.core.engine.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.keyexpr.core.engine.KeyGenerator;
import io.keyexpr.core.error.KeyResultException;
import io.keyexpr.core.model.FieldPath;
import io.keyexpr.core.model.LookupResult;
import io.keyexpr.core.spi.DocumentLookup;
import java.io.IOException;
import java.math.BigDecimal;

/**
 * {@link DocumentLookup} backed by Jackson. Only object members are walked; an array or scalar at
 * an intermediate level means the field does not exist.
 *
 * <p>Scalars are rendered as follows:
 *
 * <ul>
 *   <li>strings: as is
 *   <li>booleans: {@code true} / {@code false}
 *   <li>integers: base-10 digits of any size, e.g. {@code 10}
 *   <li>floating point: exact decimal value, trailing zeros dropped, never an exponent, e.g.
 *       {@code 3.1415}, {@code 2.50} as {@code 2.5}, {@code 1e3} as {@code 1000}
 * </ul>
 *
 * <p>A float whose fixed-point form could not fit in a key ({@code 1e300000}) fails with the
 * oversize-key error instead of being expanded.
 *
 * <p>Thread-safe.
 */
public final class JacksonDocumentLookup implements DocumentLookup {

    private final ObjectMapper mapper;

    public JacksonDocumentLookup() {
        this(new ObjectMapper());
    }

    /** Uses a copy of the given mapper, configured to keep exact decimal values. */
    public JacksonDocumentLookup(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public LookupResult lookup(byte[] document, FieldPath path) {
        return resolve(readTree(document), path);
    }

    /** Parses {@code document} on the first lookup and reuses the tree for the rest. */
    @Override
    public DocumentLookup forDocument(byte[] document) {
        return new ParsedDocument(document);
    }

    private static LookupResult resolve(JsonNode root, FieldPath path) {
        JsonNode node = root;
        for (String segment : path.segments()) {
            if (node == null || !node.isObject()) {
                return LookupResult.ABSENT;
            }
            node = node.get(segment);
        }

        if (node == null || node.isMissingNode()) {
            return LookupResult.ABSENT;
        }
        if (node.isNull()) {
            return LookupResult.NULL;
        }
        if (node.isArray()) {
            return LookupResult.ARRAY;
        }
        if (node.isObject()) {
            return LookupResult.OBJECT;
        }
        return LookupResult.scalar(render(node));
    }

    /** Renders a scalar node as a key fragment. */
    static String render(JsonNode node) {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return String.valueOf(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue().toString();
        }
        if (node.isFloatingPointNumber()) {
            return renderDecimal(node.decimalValue().stripTrailingZeros());
        }
        return node.asText();
    }

    private static String renderDecimal(BigDecimal value) {
        // digits left and right of the point in plain notation, long to survive extreme scales
        long integerDigits = (long) value.precision() - value.scale();
        long fractionDigits = value.scale();
        if (integerDigits > KeyGenerator.MAX_KEY_SIZE || fractionDigits > KeyGenerator.MAX_KEY_SIZE) {
            throw new KeyResultException(
                    String.format("generated key is larger than %d bytes", KeyGenerator.MAX_KEY_SIZE));
        }
        return value.toPlainString();
    }

    private JsonNode readTree(byte[] document) {
        try {
            return mapper.readTree(document);
        } catch (IOException e) {
            throw new KeyResultException("document is not valid JSON", e);
        }
    }

    /** Lookup bound to one document; not thread-safe, lives for a single key generation. */
    private final class ParsedDocument implements DocumentLookup {

        private final byte[] document;
        private JsonNode root;

        ParsedDocument(byte[] document) {
            this.document = document;
        }

        @Override
        public LookupResult lookup(byte[] document, FieldPath path) {
            if (document != this.document) {
                return JacksonDocumentLookup.this.lookup(document, path);
            }
            if (root == null) {
                root = readTree(document);
            }
            return resolve(root, path);
        }
    }
}
