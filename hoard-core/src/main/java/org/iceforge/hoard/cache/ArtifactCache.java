package org.iceforge.hoard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.hash.HashVerifier;
import org.iceforge.hoard.result.ErrorKind;
import org.iceforge.hoard.result.OperationResult;
import org.iceforge.hoard.serial.ArtifactSerializationException;
import org.iceforge.hoard.serial.ArtifactSerializer;
import org.iceforge.hoard.store.BlobFiles;
import org.iceforge.hoard.store.JsonMetadataStore;
import org.iceforge.hoard.store.LockService;
import org.iceforge.hoard.store.StoreUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Content-addressed, TTL-bound cache of trained artifacts.
 *
 * <p>Layout under the root directory:
 * <pre>
 *   {root}/entries/{cacheKey}.blob
 *   {root}/metadata.json          cacheKey -> CacheEntry
 * </pre>
 * Caching is an optimization: on lookup every problem with an entry (expired,
 * blob missing, digest mismatch, undecodable) is a miss, and the bad entry is
 * purged. Expiry is checked lazily on {@link #get} and by {@link #evictExpired()};
 * there is no background timer.
 */
public class ArtifactCache<A> {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final CacheSettings settings;
    private final ArtifactSerializer<A> serializer;
    private final HashVerifier hasher;
    private final ObjectMapper mapper;
    private final JsonMetadataStore<CacheIndex> index;
    private final Clock clock;

    public ArtifactCache(CacheSettings settings,
                         ArtifactSerializer<A> serializer,
                         HashVerifier hasher,
                         ObjectMapper mapper,
                         LockService locks,
                         Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.index = new JsonMetadataStore<>(settings.metadataFile(), CacheIndex.class, CacheIndex::new, mapper, locks);
        try {
            Files.createDirectories(settings.entriesDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cache directory: " + settings.entriesDir(), e);
        }
        log.info("Artifact cache at {} (ttl={})", settings.rootDir(), settings.ttl());
    }

    public CacheSettings settings() {
        return settings;
    }

    /**
     * Looks up the artifact stored for {@code (kind, configuration)}.
     *
     * @return the artifact, or empty on a miss
     * @throws IllegalArgumentException if the configuration holds unsupported values
     */
    public Optional<A> get(String kind, Map<String, ?> configuration) {
        String key = CacheKeys.cacheKey(kind, configuration);

        CacheEntry entry;
        try {
            entry = index.read().get(key);
        } catch (IOException e) {
            log.warn("Cache metadata unreadable, treating {} as a miss: {}", CacheKeys.abbreviate(key), e.toString());
            return Optional.empty();
        }
        if (entry == null) {
            log.debug("Cache miss for kind={} (key: {})", kind, CacheKeys.abbreviate(key));
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (entry.isExpired(now, settings.ttl())) {
            log.info("Cache expired (key: {}), removing stale entry", CacheKeys.abbreviate(key));
            purge(entry);
            return Optional.empty();
        }

        byte[] blob;
        try {
            blob = Files.readAllBytes(blobPath(entry));
        } catch (NoSuchFileException e) {
            log.info("Cache blob missing (key: {}), dropping entry", CacheKeys.abbreviate(key));
            purge(entry);
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to read cache blob (key: {}): {}", CacheKeys.abbreviate(key), e.toString());
            return Optional.empty();
        }

        if (!hasher.verify(blob, entry.contentHash())) {
            log.warn("Cache blob failed integrity check (key: {}), purging", CacheKeys.abbreviate(key));
            purge(entry);
            return Optional.empty();
        }

        A artifact;
        try {
            artifact = serializer.deserialize(blob);
        } catch (ArtifactSerializationException e) {
            log.warn("Failed to load cached artifact (key: {}), purging: {}", CacheKeys.abbreviate(key), e.getMessage());
            purge(entry);
            return Optional.empty();
        }

        touch(entry, now);
        log.info("Cache hit: loaded {} from cache (key: {})", kind, CacheKeys.abbreviate(key));
        return Optional.of(artifact);
    }

    /**
     * Stores {@code artifact} under {@code (kind, configuration)}, replacing any previous entry.
     */
    public OperationResult<CacheEntry> put(String kind, Map<String, ?> configuration, A artifact,
                                           Map<String, ?> metadata) {
        Objects.requireNonNull(kind, "kind");
        String key;
        Map<String, Object> normalized;
        Map<String, Object> extra;
        try {
            key = CacheKeys.cacheKey(kind, configuration);
            normalized = CacheKeys.normalize(configuration);
            extra = metadata == null ? Map.of() : mapper.convertValue(metadata, METADATA_TYPE);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(ErrorKind.INVALID_OPERATION, e.getMessage());
        }

        byte[] blob;
        try {
            blob = serializer.serialize(artifact);
        } catch (ArtifactSerializationException e) {
            log.warn("Failed to cache {}: {}", kind, e.getMessage());
            return OperationResult.failure(ErrorKind.SERIALIZATION_ERROR, e.getMessage());
        }
        String contentHash = hasher.hash(blob);

        try {
            CacheEntry stored = index.update(doc -> {
                Instant now = clock.instant();
                String location = CacheSettings.blobLocation(key);
                BlobFiles.writeAtomically(BlobFiles.resolveInside(settings.rootDir(), location), blob);
                CacheEntry e = new CacheEntry(key, kind, normalized, location, contentHash,
                        serializer.typeTag(), now, now, blob.length, extra);
                doc.put(e);
                return StoreUpdate.changed(e);
            });
            log.info("Artifact cached successfully (key: {}, {} bytes)", CacheKeys.abbreviate(key), blob.length);
            return OperationResult.ok(stored);
        } catch (IOException e) {
            log.warn("Failed to cache {} (key: {}): {}", kind, CacheKeys.abbreviate(key), e.toString());
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Failed to cache artifact: " + e.getMessage());
        }
    }

    /**
     * Returns the cached artifact, or trains it with {@code trainer} and caches the result.
     * A failed store is logged and does not fail the call.
     */
    public A getOrCompute(String kind, Map<String, ?> configuration, Supplier<? extends A> trainer,
                          Map<String, ?> metadata) {
        Objects.requireNonNull(trainer, "trainer");
        Optional<A> cached = get(kind, configuration);
        if (cached.isPresent()) {
            return cached.get();
        }
        A trained = Objects.requireNonNull(trainer.get(), "trainer returned null");
        OperationResult<CacheEntry> stored = put(kind, configuration, trained, metadata);
        if (!stored.isSuccess()) {
            log.warn("Trained {} but could not cache it: {}", kind, stored.message());
        }
        return trained;
    }

    /**
     * Removes every expired entry together with its blob.
     *
     * @return number of entries removed
     */
    public OperationResult<Integer> evictExpired() {
        try {
            int removed = index.update(doc -> {
                Instant now = clock.instant();
                int count = 0;
                for (CacheEntry entry : new ArrayList<>(doc.entries().values())) {
                    if (entry.isExpired(now, settings.ttl()) && deleteBlob(entry)) {
                        doc.remove(entry.key());
                        count++;
                        log.info("Removed expired cache: {}", CacheKeys.abbreviate(entry.key()));
                    }
                }
                return count > 0 ? StoreUpdate.changed(count) : StoreUpdate.unchanged(0);
            });
            return OperationResult.ok(removed);
        } catch (IOException e) {
            log.warn("Expired-entry sweep failed: {}", e.toString());
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Expired-entry sweep failed: " + e.getMessage());
        }
    }

    /**
     * Removes every entry. An unreadable metadata document is replaced by an empty one
     * after all blobs are deleted.
     *
     * @return number of entries (or, when recovering, blob files) removed
     */
    public OperationResult<Integer> clearAll() {
        try {
            int removed = index.update(doc -> {
                int count = 0;
                for (CacheEntry entry : new ArrayList<>(doc.entries().values())) {
                    if (deleteBlob(entry)) {
                        doc.remove(entry.key());
                        count++;
                    }
                }
                return count > 0 ? StoreUpdate.changed(count) : StoreUpdate.unchanged(0);
            });
            log.info("Cleared {} cached artifacts", removed);
            return OperationResult.ok(removed);
        } catch (JsonProcessingException e) {
            log.warn("Cache metadata unreadable, rebuilding empty cache: {}", e.getOriginalMessage());
            return rebuildEmpty();
        } catch (IOException e) {
            log.warn("Clearing cache failed: {}", e.toString());
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Clearing cache failed: " + e.getMessage());
        }
    }

    private OperationResult<Integer> rebuildEmpty() {
        int count = 0;
        try (DirectoryStream<Path> blobs = Files.newDirectoryStream(settings.entriesDir(), "*" + CacheSettings.BLOB_SUFFIX)) {
            for (Path p : blobs) {
                Files.deleteIfExists(p);
                count++;
            }
            index.reset(new CacheIndex());
            log.info("Cleared {} cached blobs", count);
            return OperationResult.ok(count);
        } catch (IOException e) {
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Rebuilding cache failed: " + e.getMessage());
        }
    }

    public OperationResult<CacheStats> stats() {
        CacheIndex doc;
        try {
            doc = index.read();
        } catch (IOException e) {
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Cache metadata unreadable: " + e.getMessage());
        }
        Instant now = clock.instant();
        int total = doc.size();
        int valid = 0;
        long bytes = 0;
        for (CacheEntry e : doc.entries().values()) {
            if (!e.isExpired(now, settings.ttl())) {
                valid++;
            }
            bytes += Math.max(0L, e.sizeBytes());
        }
        double mb = Math.round(bytes / (1024.0 * 1024.0) * 100.0) / 100.0;
        return OperationResult.ok(new CacheStats(total, valid, total - valid, bytes, mb,
                settings.rootDir().toString(), settings.ttl().toSeconds()));
    }

    private Path blobPath(CacheEntry entry) {
        return BlobFiles.resolveInside(settings.rootDir(), entry.blobLocation());
    }

    // Must run under the metadata lock; false leaves both blob and entry in place.
    private boolean deleteBlob(CacheEntry entry) {
        try {
            Files.deleteIfExists(blobPath(entry));
            return true;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to delete cache blob {}: {}", entry.blobLocation(), e.toString());
            return false;
        }
    }

    private void purge(CacheEntry seen) {
        try {
            index.update(doc -> {
                CacheEntry current = doc.get(seen.key());
                if (!seen.sameGeneration(current) || !deleteBlob(current)) {
                    return StoreUpdate.unchanged(false);
                }
                doc.remove(seen.key());
                return StoreUpdate.changed(true);
            });
        } catch (IOException e) {
            log.warn("Failed to purge cache entry {}: {}", CacheKeys.abbreviate(seen.key()), e.toString());
        }
    }

    private void touch(CacheEntry seen, Instant at) {
        try {
            index.update(doc -> {
                CacheEntry current = doc.get(seen.key());
                if (!seen.sameGeneration(current)) {
                    return StoreUpdate.unchanged(null);
                }
                doc.put(current.touched(at));
                return StoreUpdate.changed(null);
            });
        } catch (IOException e) {
            log.debug("Failed to record access for {}: {}", CacheKeys.abbreviate(seen.key()), e.toString());
        }
    }
}
