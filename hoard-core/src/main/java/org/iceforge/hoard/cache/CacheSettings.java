package org.iceforge.hoard.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Location and expiry of an {@link ArtifactCache}.
 */
public record CacheSettings(Path rootDir, Duration ttl) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    static final String ENTRIES_DIR = "entries";
    static final String METADATA_FILE = "metadata.json";
    static final String BLOB_SUFFIX = ".blob";

    public CacheSettings {
        Objects.requireNonNull(rootDir, "rootDir");
        rootDir = rootDir.toAbsolutePath().normalize();
        ttl = ttl == null ? DEFAULT_TTL : ttl;
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    public Path entriesDir() {
        return rootDir.resolve(ENTRIES_DIR);
    }

    public Path metadataFile() {
        return rootDir.resolve(METADATA_FILE);
    }

    static String blobLocation(String cacheKey) {
        return ENTRIES_DIR + "/" + cacheKey + BLOB_SUFFIX;
    }
}
