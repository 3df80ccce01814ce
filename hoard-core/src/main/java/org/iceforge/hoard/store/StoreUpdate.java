package org.iceforge.hoard.store;

import java.io.IOException;
import java.util.Objects;

/**
 * Result of a mutation applied under the document lock; {@code changed} decides
 * whether the document is written back.
 *
 * <p>{@code afterWrite}, when present, runs once the document has been written and
 * while the lock is still held. It never runs if the mutation or the write fails.
 */
public record StoreUpdate<R>(R result, boolean changed, AfterWrite afterWrite) {

    @FunctionalInterface
    public interface AfterWrite {
        void run() throws IOException;
    }

    public static <R> StoreUpdate<R> changed(R result) {
        return new StoreUpdate<>(result, true, null);
    }

    public static <R> StoreUpdate<R> changed(R result, AfterWrite afterWrite) {
        return new StoreUpdate<>(result, true, Objects.requireNonNull(afterWrite, "afterWrite"));
    }

    public static <R> StoreUpdate<R> unchanged(R result) {
        return new StoreUpdate<>(result, false, null);
    }
}
