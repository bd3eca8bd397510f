package io.keyexpr.core.engine;

import io.keyexpr.core.error.KeyResultException;
import io.keyexpr.core.model.FieldPath;
import io.keyexpr.core.model.LookupResult;
import io.keyexpr.core.spi.DocumentLookup;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One compiled unit of a key expression. Each call to {@link #next} produces one fragment of the
 * key for the given document.
 *
 * <p>The hierarchy is sealed: static text, a document field, a monotonic counter or a UUID.
 */
public sealed interface Generator {

    /**
     * Produces the next fragment.
     *
     * @param document the raw JSON document the key is generated for
     * @param lookup resolves field references in {@code document}
     * @throws KeyResultException if no fragment can be produced for this document
     */
    String next(byte[] document, DocumentLookup lookup);

    // ── Implementations ──

    /** Static text; every call returns the same string. Only useful combined with others. */
    record Text(String text) implements Generator {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String next(byte[] document, DocumentLookup lookup) {
            return text;
        }
    }

    /**
     * Value of a scalar field in the document. Missing, null and container values fail; an empty
     * string is returned as is.
     */
    record Field(FieldPath path) implements Generator {
        public Field {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String next(byte[] document, DocumentLookup lookup) {
            LookupResult result = lookup.lookup(document, path);
            if (result instanceof LookupResult.Scalar scalar) {
                return scalar.value();
            }
            if (result instanceof LookupResult.Null) {
                throw new KeyResultException("resulting field is null");
            }
            if (result instanceof LookupResult.Array || result instanceof LookupResult.ObjectValue) {
                throw new KeyResultException("resulting field is a JSON array/object");
            }
            throw new KeyResultException("resulting field does not exist");
        }
    }

    /**
     * Monotonically increasing base-10 counter. Returns the current value and then increments it;
     * the counter is never reset for the life of the pipeline. It does not wrap: every call after
     * {@link Long#MAX_VALUE} has been returned fails.
     */
    final class MonoIncr implements Generator {

        /** Start used when none is given or the given one is not positive. */
        public static final long DEFAULT_START = 1;

        private final long start;
        private final AtomicLong value;

        public MonoIncr() {
            this(DEFAULT_START);
        }

        public MonoIncr(long start) {
            this.start = start > 0 ? start : DEFAULT_START;
            this.value = new AtomicLong(this.start);
        }

        /** @throws KeyResultException once the counter has passed {@link Long#MAX_VALUE} */
        @Override
        public String next(byte[] document, DocumentLookup lookup) {
            long current = value.getAndIncrement();
            // wrapped around to negative values
            if (current < start) {
                throw new KeyResultException("MONO_INCR counter overflowed past " + Long.MAX_VALUE);
            }
            return Long.toString(current);
        }

        /** The first value this counter returned (or will return). */
        public long start() {
            return start;
        }

        @Override
        public String toString() {
            return "MonoIncr[start=" + start + ", next=" + value.get() + "]";
        }
    }

    /** Random version 4 UUID, freshly generated on every call. */
    record Uuid() implements Generator {
        @Override
        public String next(byte[] document, DocumentLookup lookup) {
            return UUID.randomUUID().toString();
        }
    }
}
