package org.iceforge.hoard.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One cached artifact as recorded in {@code metadata.json}.
 *
 * @param blobLocation blob path relative to the cache root
 * @param contentHash  digest of the blob bytes at store time
 */
public record CacheEntry(
        String key,
        String kind,
        Map<String, Object> configuration,
        String blobLocation,
        String contentHash,
        String typeTag,
        Instant createdAt,
        Instant lastAccessedAt,
        long sizeBytes,
        Map<String, Object> extraMetadata
) {
    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(blobLocation, "blobLocation");
        Objects.requireNonNull(createdAt, "createdAt");
        configuration = copy(configuration);
        extraMetadata = copy(extraMetadata);
        if (lastAccessedAt == null) {
            lastAccessedAt = createdAt;
        }
    }

    private static Map<String, Object> copy(Map<String, Object> m) {
        return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    /**
     * Valid while {@code now < createdAt + ttl}.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(createdAt.plus(ttl));
    }

    public CacheEntry touched(Instant at) {
        return new CacheEntry(key, kind, configuration, blobLocation, contentHash, typeTag,
                createdAt, at, sizeBytes, extraMetadata);
    }

    /**
     * True if {@code other} describes the same stored blob, i.e. nobody re-put the key in between.
     */
    boolean sameGeneration(CacheEntry other) {
        return other != null
                && key.equals(other.key)
                && createdAt.equals(other.createdAt)
                && Objects.equals(contentHash, other.contentHash);
    }
}
