package org.iceforge.hoard.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.api.ModelVersionController;
import org.iceforge.hoard.api.ResponseBodies;
import org.iceforge.hoard.api.VersionRequest;
import org.iceforge.hoard.cache.ArtifactCache;
import org.iceforge.hoard.registry.VersionRegistry;
import org.iceforge.hoard.result.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps {@code <command> [json-request]} onto cache and registry operations.
 * Every outcome, including unknown commands and malformed requests, is a response map.
 */
@Service
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final Set<String> COMMANDS = new TreeSet<>(Set.of(
            "stats", "clear-expired", "clear-all",
            "create_version", "list_versions", "get_version", "rollback", "compare_versions", "delete_version"));

    private final ArtifactCache<?> cache;
    private final VersionRegistry registry;
    private final ObjectMapper mapper;

    public CommandDispatcher(ArtifactCache<?> cache, VersionRegistry registry, ObjectMapper mapper) {
        this.cache = Objects.requireNonNull(cache);
        this.registry = Objects.requireNonNull(registry);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public Map<String, Object> dispatch(String command, String requestJson) {
        String cmd = command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
        if (!COMMANDS.contains(cmd)) {
            return ResponseBodies.failure(ErrorKind.INVALID_OPERATION,
                    "Unknown command: " + command + " (expected one of " + COMMANDS + ")");
        }

        VersionRequest req;
        try {
            req = parse(requestJson);
        } catch (JsonProcessingException e) {
            return ResponseBodies.failure(ErrorKind.INVALID_OPERATION, "Malformed request: " + e.getOriginalMessage());
        }

        try {
            return run(cmd, req);
        } catch (Exception e) {
            log.error("Command {} failed", cmd, e);
            return ResponseBodies.failure(ErrorKind.UNEXPECTED, e.toString());
        }
    }

    private Map<String, Object> run(String cmd, VersionRequest req) {
        return switch (cmd) {
            case "stats" -> ResponseBodies.body(cache.stats(), mapper);
            case "clear-expired" -> ResponseBodies.body(cache.evictExpired(), "removed", mapper);
            case "clear-all" -> ResponseBodies.body(cache.clearAll(), "removed", mapper);
            case "create_version" -> ResponseBodies.body(ModelVersionController.createVersion(registry, req), mapper);
            case "list_versions" -> ResponseBodies.body(registry.listVersions(req.modelId()), mapper);
            case "get_version" -> ResponseBodies.body(registry.getVersion(req.modelId(), req.versionId()),
                    "version_info", mapper);
            case "rollback" -> ResponseBodies.body(registry.rollback(req.modelId(), req.versionId()), mapper);
            case "compare_versions" -> ResponseBodies.body(
                    registry.compareVersions(req.modelId(), req.versionId1(), req.versionId2()), "comparison", mapper);
            case "delete_version" -> ResponseBodies.body(registry.deleteVersion(req.modelId(), req.versionId()), mapper);
            default -> throw new IllegalStateException("unhandled command " + cmd);
        };
    }

    private VersionRequest parse(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return VersionRequest.EMPTY;
        }
        VersionRequest req = mapper.readValue(json, VersionRequest.class);
        return req == null ? VersionRequest.EMPTY : req;
    }
}
