package io.keyexpr.core.model;

import io.keyexpr.core.error.InvalidDelimiterException;

/**
 * The field and generator delimiter characters used by a key expression, for example {@code %}
 * in {@code %name%} and {@code #} in {@code #UUID#}.
 *
 * <p>Validated on construction; immutable and thread-safe.
 *
 * @param field     delimiter that opens and closes a field reference
 * @param generator delimiter that opens and closes a built-in generator
 */
public record Delimiters(char field, char generator) {

    /** Default field delimiter. */
    public static final char DEFAULT_FIELD = '%';

    /** Default generator delimiter. */
    public static final char DEFAULT_GENERATOR = '#';

    /** The default {@code %}/{@code #} pair. */
    public static final Delimiters DEFAULT = new Delimiters(DEFAULT_FIELD, DEFAULT_GENERATOR);

    public Delimiters {
        validate(field, generator);
    }

    /**
     * Checks a delimiter pair, first failing rule wins.
     *
     * @throws InvalidDelimiterException if either delimiter is zero, '.' or '`', or both are equal
     */
    public static void validate(char field, char generator) {
        if (field == 0) {
            throw new InvalidDelimiterException("field delimiter can not be the empty string");
        }
        if (generator == 0) {
            throw new InvalidDelimiterException("generator delimiter can not be the empty string");
        }
        if (field == FieldPath.PERIOD || generator == FieldPath.PERIOD) {
            throw new InvalidDelimiterException("cannot use . as a field or generator delimiter");
        }
        if (field == FieldPath.BACKTICK || generator == FieldPath.BACKTICK) {
            throw new InvalidDelimiterException("cannot use ` as a field or generator delimiter");
        }
        if (field == generator) {
            throw new InvalidDelimiterException("field delimiter and generator delimiter can not be the same");
        }
    }
}
