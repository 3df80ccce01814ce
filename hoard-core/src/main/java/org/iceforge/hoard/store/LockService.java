package org.iceforge.hoard.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Mutual exclusion for read-modify-write of a shared metadata document.
 *
 * <p>A held lock excludes other threads of this JVM and other processes using the
 * same implementation against the same document. Locks are not reentrant.
 */
public interface LockService {

    /**
     * Blocks until the lock for {@code document} is held or the implementation's
     * timeout elapses.
     *
     * @throws LockTimeoutException if the lock could not be obtained in time
     */
    Lock acquire(Path document) throws IOException;

    interface Lock extends AutoCloseable {
        @Override
        void close() throws IOException;
    }
}
