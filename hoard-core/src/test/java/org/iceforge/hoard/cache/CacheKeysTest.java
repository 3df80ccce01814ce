package org.iceforge.hoard.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeysTest {

    @Test
    void key_ignoresMapOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("n_estimators", 100);
        a.put("params", Map.of("depth", 5, "lr", 0.1));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("params", new LinkedHashMap<>(Map.of("lr", 0.1, "depth", 5)));
        b.put("n_estimators", 100);

        assertThat(CacheKeys.cacheKey("rf", a)).isEqualTo(CacheKeys.cacheKey("rf", b));
    }

    @Test
    void key_dependsOnKindAndValues() {
        Map<String, Object> cfg = Map.of("n", 100);

        assertThat(CacheKeys.cacheKey("rf", cfg)).isNotEqualTo(CacheKeys.cacheKey("gbm", cfg));
        assertThat(CacheKeys.cacheKey("rf", cfg)).isNotEqualTo(CacheKeys.cacheKey("rf", Map.of("n", 101)));
        assertThat(CacheKeys.cacheKey("rf", cfg)).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void canonicalJson_sortsNestedKeys() {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("b", List.of(Map.of("y", 1, "x", true)));
        cfg.put("a", "s");

        assertThat(CacheKeys.canonicalJson(cfg)).isEqualTo("{\"a\":\"s\",\"b\":[{\"x\":true,\"y\":1}]}");
    }

    @Test
    void nullConfiguration_isEmpty() {
        assertThat(CacheKeys.cacheKey("rf", null)).isEqualTo(CacheKeys.cacheKey("rf", Map.of()));
    }

    @Test
    void unsupportedValue_isRejected() {
        assertThatThrownBy(() -> CacheKeys.cacheKey("rf", Map.of("cb", new Object())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cb");
    }

    @Test
    void abbreviate_keepsEightChars() {
        assertThat(CacheKeys.abbreviate("0123456789abcdef")).isEqualTo("01234567...");
        assertThat(CacheKeys.abbreviate("abc")).isEqualTo("abc");
    }
}
