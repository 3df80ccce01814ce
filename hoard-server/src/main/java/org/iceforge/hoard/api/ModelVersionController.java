package org.iceforge.hoard.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.registry.CreatedVersion;
import org.iceforge.hoard.registry.VersionRegistry;
import org.iceforge.hoard.result.ErrorKind;
import org.iceforge.hoard.result.OperationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/versions")
public class ModelVersionController {

    private final VersionRegistry registry;
    private final ObjectMapper mapper;

    public ModelVersionController(VersionRegistry registry, ObjectMapper mapper) {
        this.registry = Objects.requireNonNull(registry);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @PostMapping("/create")
    public ResponseEntity<Map<String, Object>> create(@RequestBody VersionRequest req) {
        OperationResult<CreatedVersion> result = createVersion(registry, req);
        return ResponseBodies.respond(result, ResponseBodies.body(result, mapper));
    }

    @GetMapping("/list/{modelId}")
    public ResponseEntity<Map<String, Object>> list(@PathVariable String modelId) {
        var result = registry.listVersions(modelId);
        return ResponseBodies.respond(result, ResponseBodies.body(result, mapper));
    }

    @GetMapping("/get/{modelId}/{versionId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String modelId, @PathVariable String versionId) {
        var result = registry.getVersion(modelId, versionId);
        return ResponseBodies.respond(result, ResponseBodies.body(result, "version_info", mapper));
    }

    @PostMapping("/rollback")
    public ResponseEntity<Map<String, Object>> rollback(@RequestBody VersionRequest req) {
        var result = registry.rollback(req.modelId(), req.versionId());
        return ResponseBodies.respond(result, ResponseBodies.body(result, mapper));
    }

    @PostMapping("/compare")
    public ResponseEntity<Map<String, Object>> compare(@RequestBody VersionRequest req) {
        var result = registry.compareVersions(req.modelId(), req.versionId1(), req.versionId2());
        return ResponseBodies.respond(result, ResponseBodies.body(result, "comparison", mapper));
    }

    @DeleteMapping("/{modelId}/{versionId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String modelId, @PathVariable String versionId) {
        var result = registry.deleteVersion(modelId, versionId);
        return ResponseBodies.respond(result, ResponseBodies.body(result, mapper));
    }

    /**
     * Registers {@code model_path} as a new version. Activation is requested either
     * with {@code activate} or with {@code set_as_current} in the metadata.
     */
    public static OperationResult<CreatedVersion> createVersion(VersionRegistry registry, VersionRequest req) {
        if (req.modelPath() == null || req.modelPath().isBlank()) {
            return OperationResult.failure(ErrorKind.INVALID_OPERATION, "model_path is required");
        }
        Path source;
        try {
            source = Path.of(req.modelPath());
        } catch (InvalidPathException e) {
            return OperationResult.failure(ErrorKind.INVALID_OPERATION, "Invalid model_path: " + e.getMessage());
        }
        if (req.activateRequested()) {
            return registry.createVersion(req.modelId(), source, req.versionTag(), req.metadata(), true);
        }
        return registry.createVersion(req.modelId(), source, req.versionTag(), req.metadata());
    }
}
