package org.iceforge.hoard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.hash.HashVerifier;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Derives content-addressed cache keys from (artifact kind, configuration).
 *
 * <pre>
 *   key = sha256( kind + ":" + canonicalJson(configuration) )
 * </pre>
 * Canonical JSON sorts map keys at every level, so two configurations that differ
 * only in iteration order share a key. Values must be JSON primitives, or lists and
 * maps of them.
 */
public final class CacheKeys {
    private CacheKeys() {}

    private static final ObjectMapper CANONICAL = new ObjectMapper();

    public static String cacheKey(String kind, Map<String, ?> configuration) {
        Objects.requireNonNull(kind, "kind");
        return HashVerifier.sha256Hex(kind + ":" + canonicalJson(configuration));
    }

    public static String canonicalJson(Map<String, ?> configuration) {
        try {
            return CANONICAL.writeValueAsString(normalize(configuration));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Configuration is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Returns a sorted, type-checked copy of {@code configuration}; {@code null} is
     * treated as an empty configuration.
     *
     * @throws IllegalArgumentException on a value that is not a JSON primitive, list or map
     */
    public static Map<String, Object> normalize(Map<String, ?> configuration) {
        if (configuration == null) {
            return Collections.emptyMap();
        }
        return normalizeMap(configuration, "");
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> map, String path) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String k)) {
                throw new IllegalArgumentException("Unsupported configuration key at '" + path + "': " + e.getKey());
            }
            String child = path.isEmpty() ? k : path + "." + k;
            sorted.put(k, normalizeValue(e.getValue(), child));
        }
        return Collections.unmodifiableMap(sorted);
    }

    private static Object normalizeValue(Object v, String path) {
        if (v == null || v instanceof String || v instanceof Boolean) {
            return v;
        }
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte
                || v instanceof Double || v instanceof Float
                || v instanceof BigDecimal || v instanceof BigInteger) {
            return v;
        }
        if (v instanceof Map<?, ?> m) {
            return normalizeMap(m, path);
        }
        if (v instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                out.add(normalizeValue(list.get(i), path + "[" + i + "]"));
            }
            return Collections.unmodifiableList(out);
        }
        throw new IllegalArgumentException("Unsupported configuration value for key '" + path + "': "
                + v.getClass().getName());
    }

    static String abbreviate(String key) {
        return key.length() <= 8 ? key : key.substring(0, 8) + "...";
    }
}
