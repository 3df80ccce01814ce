package org.iceforge.hoard.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.cache.ArtifactCache;
import org.iceforge.hoard.result.OperationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final ArtifactCache<?> cache;
    private final ObjectMapper mapper;

    public CacheController(ArtifactCache<?> cache, ObjectMapper mapper) {
        this.cache = Objects.requireNonNull(cache);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        var result = cache.stats();
        return ResponseBodies.respond(result, ResponseBodies.body(result, mapper));
    }

    @PostMapping("/clear-expired")
    public ResponseEntity<Map<String, Object>> clearExpired() {
        var result = cache.evictExpired();
        return ResponseBodies.respond(result, ResponseBodies.body(result, "removed", mapper));
    }

    @PostMapping("/clear-all")
    public ResponseEntity<Map<String, Object>> clearAll() {
        OperationResult<Integer> result = cache.clearAll();
        return ResponseBodies.respond(result, ResponseBodies.body(result, "removed", mapper));
    }
}
