package io.keyexpr.core.spi;

import io.keyexpr.core.model.FieldPath;
import io.keyexpr.core.model.LookupResult;

/**
 * Resolves a {@link FieldPath} inside a raw JSON document. The key engine never decodes JSON
 * itself; field references delegate to this collaborator.
 *
 * <p>Implementations MUST be stateless and thread-safe, and are expected to be fast and CPU-bound
 * (no I/O).
 */
public interface DocumentLookup {

    /**
     * Looks up the given path in the document.
     *
     * @param document the raw JSON document
     * @param path the field to resolve
     * @return the lookup outcome, never {@code null}
     * @throws io.keyexpr.core.error.KeyResultException if the document can not be read at all
     */
    LookupResult lookup(byte[] document, FieldPath path);

    /**
     * Returns a lookup to use for every field of one key generation over {@code document}.
     * Implementations that decode the document may decode it once here and share the result; the
     * returned lookup is used by a single thread and discarded afterwards. Defaults to {@code
     * this}.
     */
    default DocumentLookup forDocument(byte[] document) {
        return this;
    }
}
