package org.iceforge.hoard.store;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Child process for {@link FileLockServiceCrossProcessTest}: takes the document lock,
 * creates the ready marker, and holds the lock until the release marker appears.
 *
 * <p>Arguments: {@code <document> <ready-marker> <release-marker>}.
 */
public final class LockHolder {
    private LockHolder() {}

    public static void main(String[] args) throws Exception {
        Path document = Path.of(args[0]);
        Path ready = Path.of(args[1]);
        Path release = Path.of(args[2]);

        FileLockService locks = new FileLockService(Duration.ofSeconds(30));
        try (LockService.Lock ignored = locks.acquire(document)) {
            Files.createFile(ready);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(60);
            while (!Files.exists(release) && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
        }
    }
}
