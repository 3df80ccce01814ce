package org.iceforge.hoard.cache;

import org.iceforge.hoard.hash.HashVerifier;
import org.iceforge.hoard.result.OperationResult;
import org.iceforge.hoard.serial.RawBytesSerializer;
import org.iceforge.hoard.store.FileLockService;
import org.iceforge.hoard.store.HoardObjectMappers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Child process for {@link ArtifactCacheCrossProcessTest}: puts {@code count} entries
 * with distinct configurations into the cache at {@code root}. Exits with 1 on the
 * first failed put.
 *
 * <p>Arguments: {@code <root> <worker-name> <count>}.
 */
public final class CachePutter {
    private CachePutter() {}

    public static void main(String[] args) {
        Path root = Path.of(args[0]);
        String worker = args[1];
        int count = Integer.parseInt(args[2]);

        ArtifactCache<byte[]> cache = new ArtifactCache<>(new CacheSettings(root, Duration.ofHours(24)),
                new RawBytesSerializer(), new HashVerifier(), HoardObjectMappers.metadataMapper(),
                new FileLockService(Duration.ofSeconds(60)), Clock.systemUTC());
        for (int i = 0; i < count; i++) {
            OperationResult<CacheEntry> r = cache.put("model", Map.of("worker", worker, "n", i),
                    (worker + "-" + i).getBytes(StandardCharsets.UTF_8), null);
            if (!r.isSuccess()) {
                System.err.println("put " + i + " failed: " + r.message());
                System.exit(1);
            }
        }
    }
}
