package org.iceforge.hoard.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory lock on a {@code <document>.lock} sidecar file.
 *
 * <p>OS file locks are held per process, so threads of this JVM are serialized
 * first on an in-process lock keyed by the sidecar path; only the holder of that
 * lock competes for the file lock against other processes.
 */
public class FileLockService implements LockService {

    private static final Logger log = LoggerFactory.getLogger(FileLockService.class);

    private static final long MIN_BACKOFF_MS = 5;
    private static final long MAX_BACKOFF_MS = 100;

    // Shared by all instances: the JVM may hold only one FileLock per file.
    private static final ConcurrentHashMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Duration timeout;

    public FileLockService(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("lock timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    static Path lockFileFor(Path document) {
        Path abs = document.toAbsolutePath().normalize();
        return abs.resolveSibling(abs.getFileName().toString() + ".lock");
    }

    @Override
    public Lock acquire(Path document) throws IOException {
        Objects.requireNonNull(document, "document");
        Path lockFile = lockFileFor(document);
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(lockFile, k -> new ReentrantLock());
        if (local.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock on " + document + " is already held by this thread");
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!local.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException(document, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock on " + document);
        }

        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock;
            long backoff = MIN_BACKOFF_MS;
            while ((fileLock = channel.tryLock()) == null) {
                if (System.nanoTime() >= deadline) {
                    throw new LockTimeoutException(document, timeout);
                }
                log.debug("Lock contention on {}, retrying in {} ms", lockFile, backoff);
                sleep(backoff, document);
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
            }
            return new HeldLock(local, channel, fileLock);
        } catch (IOException | RuntimeException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            local.unlock();
            throw e;
        }
    }

    private static void sleep(long millis, Path document) throws InterruptedIOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock on " + document);
        }
    }

    private static final class HeldLock implements Lock {
        private final ReentrantLock local;
        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean released;

        private HeldLock(ReentrantLock local, FileChannel channel, FileLock fileLock) {
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() throws IOException {
            if (released) {
                return;
            }
            released = true;
            try {
                fileLock.release();
            } finally {
                try {
                    channel.close();
                } finally {
                    local.unlock();
                }
            }
        }
    }
}
