package org.iceforge.hoard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.cache.ArtifactCache;
import org.iceforge.hoard.cache.CacheSettings;
import org.iceforge.hoard.hash.HashVerifier;
import org.iceforge.hoard.registry.RegistrySettings;
import org.iceforge.hoard.registry.VersionRegistry;
import org.iceforge.hoard.serial.RawBytesSerializer;
import org.iceforge.hoard.store.FileLockService;
import org.iceforge.hoard.store.HoardObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = HoardObjectMappers.metadataMapper();
    private ArtifactCache<byte[]> cache;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        FileLockService locks = new FileLockService(Duration.ofSeconds(5));
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
        cache = new ArtifactCache<>(new CacheSettings(dir.resolve("cache"), Duration.ofHours(1)),
                new RawBytesSerializer(), new HashVerifier(), mapper, locks, clock);
        VersionRegistry registry = new VersionRegistry(new RegistrySettings(dir.resolve("models")),
                new HashVerifier(), mapper, locks, clock);
        dispatcher = new CommandDispatcher(cache, registry, mapper);
    }

    private String request(Map<String, Object> fields) throws Exception {
        return mapper.writeValueAsString(fields);
    }

    @Test
    void unknownCommand_fails() {
        Map<String, Object> out = dispatcher.dispatch("train", null);

        assertEquals(false, out.get("success"));
        assertEquals("invalid_operation", out.get("type"));
    }

    @Test
    void malformedRequest_fails() {
        Map<String, Object> out = dispatcher.dispatch("list_versions", "{not json");

        assertEquals(false, out.get("success"));
        assertEquals("invalid_operation", out.get("type"));
    }

    @Test
    void stats_onEmptyCache() {
        Map<String, Object> out = dispatcher.dispatch("stats", null);

        assertEquals(true, out.get("success"));
        assertEquals(0, out.get("total_entries"));
        assertEquals(3600L, ((Number) out.get("ttl_seconds")).longValue());
    }

    @Test
    void clearAll_reportsRemoved() {
        cache.put("rf", Map.of("n", 1), new byte[]{1}, null);

        Map<String, Object> out = dispatcher.dispatch("clear-all", "");

        assertEquals(true, out.get("success"));
        assertEquals(1, out.get("removed"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void versionCommands_roundTrip() throws Exception {
        Path v1 = dir.resolve("v1.bin");
        Path v2 = dir.resolve("v2.bin");
        Files.writeString(v1, "one");
        Files.writeString(v2, "two");

        Map<String, Object> created = dispatcher.dispatch("create_version", request(Map.of(
                "model_id", "house_price", "model_path", v1.toString(), "version_tag", "first")));
        assertEquals(true, created.get("success"));
        assertEquals("v1", ((Map<String, Object>) created.get("version_info")).get("version_id"));

        dispatcher.dispatch("create_version", request(Map.of(
                "model_id", "house_price", "model_path", v2.toString(),
                "metadata", Map.of("set_as_current", true))));

        Map<String, Object> listed = dispatcher.dispatch("list_versions", request(Map.of("model_id", "house_price")));
        assertEquals("v2", listed.get("current_version"));
        assertEquals(2, ((List<?>) listed.get("versions")).size());

        Map<String, Object> rolled = dispatcher.dispatch("rollback",
                request(Map.of("model_id", "house_price", "version_id", "v1")));
        assertEquals("v1", rolled.get("rolled_back_to"));

        Map<String, Object> compared = dispatcher.dispatch("compare_versions",
                request(Map.of("model_id", "house_price", "version_id_1", "v1", "version_id_2", "v2")));
        assertEquals(true, compared.get("success"));

        Map<String, Object> deleted = dispatcher.dispatch("delete_version",
                request(Map.of("model_id", "house_price", "version_id", "v2")));
        assertEquals(1, deleted.get("remaining_versions"));

        Map<String, Object> gone = dispatcher.dispatch("get_version",
                request(Map.of("model_id", "house_price", "version_id", "v2")));
        assertEquals(false, gone.get("success"));
        assertEquals("not_found", gone.get("type"));
    }
}
