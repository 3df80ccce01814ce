package org.iceforge.hoard.cache;

import org.iceforge.hoard.ChildJvm;
import org.iceforge.hoard.hash.HashVerifier;
import org.iceforge.hoard.serial.RawBytesSerializer;
import org.iceforge.hoard.store.FileLockService;
import org.iceforge.hoard.store.HoardObjectMappers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactCacheCrossProcessTest {

    private static final int PUTS_PER_PROCESS = 30;

    @TempDir
    Path root;

    @TempDir
    Path logs;

    @Test
    void putsFromTwoProcesses_areNotLost() throws Exception {
        Path outA = logs.resolve("a.log");
        Path outB = logs.resolve("b.log");
        Process a = ChildJvm.start(CachePutter.class, outA, root.toString(), "a", String.valueOf(PUTS_PER_PROCESS));
        Process b = ChildJvm.start(CachePutter.class, outB, root.toString(), "b", String.valueOf(PUTS_PER_PROCESS));
        try {
            assertTrue(a.waitFor(120, TimeUnit.SECONDS), "first writer did not finish");
            assertTrue(b.waitFor(120, TimeUnit.SECONDS), "second writer did not finish");
            assertEquals(0, a.exitValue(), ChildJvm.readOutput(outA));
            assertEquals(0, b.exitValue(), ChildJvm.readOutput(outB));
        } finally {
            a.destroyForcibly();
            b.destroyForcibly();
        }

        ArtifactCache<byte[]> cache = new ArtifactCache<>(new CacheSettings(root, Duration.ofHours(24)),
                new RawBytesSerializer(), new HashVerifier(), HoardObjectMappers.metadataMapper(),
                new FileLockService(Duration.ofSeconds(5)), Clock.systemUTC());
        CacheStats stats = cache.stats().value();
        assertEquals(2 * PUTS_PER_PROCESS, stats.totalEntries());
        assertEquals(2 * PUTS_PER_PROCESS, stats.validEntries());
        try (Stream<Path> blobs = Files.list(cache.settings().entriesDir())) {
            List<Path> files = blobs.filter(p -> p.toString().endsWith(".blob")).toList();
            assertEquals(2 * PUTS_PER_PROCESS, files.size());
        }
        for (String worker : List.of("a", "b")) {
            int last = PUTS_PER_PROCESS - 1;
            byte[] value = cache.get("model", Map.of("worker", worker, "n", last)).orElseThrow();
            assertEquals(worker + "-" + last, new String(value, StandardCharsets.UTF_8));
        }
    }
}
