package org.iceforge.hoard.serial;

/**
 * Raised when a blob cannot be produced from, or turned back into, an artifact.
 */
public class ArtifactSerializationException extends Exception {

    public ArtifactSerializationException(String message) {
        super(message);
    }

    public ArtifactSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
