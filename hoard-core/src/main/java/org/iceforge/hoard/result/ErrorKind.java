package org.iceforge.hoard.result;

import java.util.Locale;

/**
 * Classified failure of a cache or registry operation.
 */
public enum ErrorKind {
    /** Unknown model, version or cache key. */
    NOT_FOUND,
    /** Stored blob no longer matches its recorded digest. */
    INTEGRITY_VIOLATION,
    /** Request is well-formed but not allowed, e.g. deleting the active version. */
    INVALID_OPERATION,
    /** Blob could not be produced from, or turned back into, an artifact. */
    SERIALIZATION_ERROR,
    /** Disk or filesystem failure, including lock timeouts. */
    IO_FAILURE,
    UNEXPECTED;

    /** Wire name used in CLI and HTTP responses, e.g. {@code "not_found"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
