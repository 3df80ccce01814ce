package org.iceforge.hoard.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Owns one JSON metadata document on disk.
 *
 * <p>Nothing is cached in memory: {@link #read()} always goes to disk, and
 * {@link #update(Mutation)} re-reads the document after taking the lock so that
 * concurrent writers never overwrite each other's changes.
 *
 * @param <D> document type; must be a mutable Jackson bean
 */
public final class JsonMetadataStore<D> {

    private static final Logger log = LoggerFactory.getLogger(JsonMetadataStore.class);

    @FunctionalInterface
    public interface Mutation<D, R> {
        /**
         * Applies changes to {@code document} in place.
         */
        StoreUpdate<R> apply(D document) throws IOException;
    }

    private final Path document;
    private final Class<D> type;
    private final Supplier<D> emptyDocument;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final LockService locks;

    public JsonMetadataStore(Path document, Class<D> type, Supplier<D> emptyDocument,
                             ObjectMapper mapper, LockService locks) {
        this.document = Objects.requireNonNull(document, "document").toAbsolutePath().normalize();
        this.type = Objects.requireNonNull(type, "type");
        this.emptyDocument = Objects.requireNonNull(emptyDocument, "emptyDocument");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = mapper.writerWithDefaultPrettyPrinter();
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    public Path document() {
        return document;
    }

    /**
     * Reads the current document without locking. A missing or empty file reads
     * as the empty document.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public D read() throws IOException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(document);
        } catch (NoSuchFileException e) {
            return emptyDocument.get();
        }
        if (bytes.length == 0) {
            return emptyDocument.get();
        }
        D value = mapper.readValue(bytes, type);
        return value == null ? emptyDocument.get() : value;
    }

    /**
     * Read-modify-write under the document lock. Side effects that must not be
     * visible unless the new document is on disk belong in {@link StoreUpdate#afterWrite()}.
     */
    public <R> R update(Mutation<D, R> mutation) throws IOException {
        Objects.requireNonNull(mutation, "mutation");
        try (LockService.Lock ignored = locks.acquire(document)) {
            D current = read();
            StoreUpdate<R> update = mutation.apply(current);
            if (update.changed()) {
                write(current);
                if (update.afterWrite() != null) {
                    update.afterWrite().run();
                }
            }
            return update.result();
        }
    }

    /**
     * Replaces the document with {@code value} under the lock, ignoring whatever
     * is on disk. Used to recover from an unreadable document.
     */
    public void reset(D value) throws IOException {
        Objects.requireNonNull(value, "value");
        try (LockService.Lock ignored = locks.acquire(document)) {
            write(value);
        }
    }

    private void write(D value) throws IOException {
        BlobFiles.writeAtomically(document, writer.writeValueAsBytes(value));
        log.debug("Wrote metadata document {}", document);
    }
}
