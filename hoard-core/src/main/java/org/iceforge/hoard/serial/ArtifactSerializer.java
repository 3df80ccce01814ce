package org.iceforge.hoard.serial;

/**
 * Moves an artifact to and from its byte representation.
 *
 * <p>The stores never look inside an artifact; they only hash and move the bytes
 * produced here. Implementations must be able to read back whatever they wrote.
 *
 * @param <A> artifact type
 */
public interface ArtifactSerializer<A> {

    /**
     * Short identifier of the encoding, recorded next to stored blobs.
     */
    String typeTag();

    byte[] serialize(A artifact) throws ArtifactSerializationException;

    A deserialize(byte[] blob) throws ArtifactSerializationException;
}
