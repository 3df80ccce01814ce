package org.iceforge.hoard.cache;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.Map;
import java.util.TreeMap;

/**
 * The {@code metadata.json} document: cache key to {@link CacheEntry}.
 */
public class CacheIndex {

    private final Map<String, CacheEntry> entries = new TreeMap<>();

    @JsonAnyGetter
    public Map<String, CacheEntry> entries() {
        return entries;
    }

    @JsonAnySetter
    public void put(String key, CacheEntry entry) {
        entries.put(key, entry);
    }

    public void put(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    public CacheEntry get(String key) {
        return entries.get(key);
    }

    public CacheEntry remove(String key) {
        return entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
