package org.iceforge.hoard.serial;

import java.util.Arrays;

/**
 * Identity codec for producers that hand over pre-serialized artifacts.
 */
public final class RawBytesSerializer implements ArtifactSerializer<byte[]> {

    public static final String TYPE_TAG = "raw";

    @Override
    public String typeTag() {
        return TYPE_TAG;
    }

    @Override
    public byte[] serialize(byte[] artifact) throws ArtifactSerializationException {
        if (artifact == null) {
            throw new ArtifactSerializationException("artifact is null");
        }
        return Arrays.copyOf(artifact, artifact.length);
    }

    @Override
    public byte[] deserialize(byte[] blob) throws ArtifactSerializationException {
        if (blob == null) {
            throw new ArtifactSerializationException("blob is null");
        }
        return Arrays.copyOf(blob, blob.length);
    }
}
