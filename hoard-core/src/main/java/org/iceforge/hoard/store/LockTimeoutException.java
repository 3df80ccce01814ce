package org.iceforge.hoard.store;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

public class LockTimeoutException extends IOException {

    private final Path document;

    public LockTimeoutException(Path document, Duration waited) {
        super("Timed out after " + waited.toMillis() + " ms waiting for lock on " + document);
        this.document = document;
    }

    public Path document() {
        return document;
    }
}
