package io.keyexpr.core.model;

import java.util.Objects;

/**
 * Outcome of looking up a {@link FieldPath} in a JSON document. Sealed: a lookup is either absent,
 * a JSON null, a container (array or object) or a scalar already rendered as a string.
 */
public sealed interface LookupResult {

    LookupResult ABSENT = new Absent();
    LookupResult NULL = new Null();
    LookupResult ARRAY = new Array();
    LookupResult OBJECT = new ObjectValue();

    /** The path does not exist in the document. */
    record Absent() implements LookupResult {}

    /** The path resolves to JSON {@code null}. */
    record Null() implements LookupResult {}

    /** The path resolves to a JSON array. */
    record Array() implements LookupResult {}

    /** The path resolves to a JSON object. */
    record ObjectValue() implements LookupResult {}

    /**
     * The path resolves to a string, number or boolean.
     *
     * @param value canonical string form of the scalar (may be empty)
     */
    record Scalar(String value) implements LookupResult {
        public Scalar {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    static LookupResult scalar(String value) {
        return new Scalar(value);
    }
}
