package org.iceforge.hoard.cache;

public record CacheStats(
        int totalEntries,
        int validEntries,
        int expiredEntries,
        long totalBytes,
        double totalSizeMb,
        String cacheDir,
        long ttlSeconds
) {}
