package org.iceforge.hoard.serial;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON codec bound to one concrete artifact class.
 *
 * <p>Only the declared target type is ever instantiated; the mapper must not have
 * default typing enabled.
 */
public final class JacksonArtifactSerializer<A> implements ArtifactSerializer<A> {

    private final ObjectMapper mapper;
    private final Class<A> type;

    public JacksonArtifactSerializer(ObjectMapper mapper, Class<A> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public String typeTag() {
        return "json:" + type.getName();
    }

    @Override
    public byte[] serialize(A artifact) throws ArtifactSerializationException {
        if (artifact == null) {
            throw new ArtifactSerializationException("artifact is null");
        }
        try {
            return mapper.writeValueAsBytes(artifact);
        } catch (JsonProcessingException e) {
            throw new ArtifactSerializationException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    @Override
    public A deserialize(byte[] blob) throws ArtifactSerializationException {
        if (blob == null || blob.length == 0) {
            throw new ArtifactSerializationException("empty blob for " + type.getSimpleName());
        }
        try {
            A value = mapper.readValue(blob, type);
            if (value == null) {
                throw new ArtifactSerializationException("blob decoded to null " + type.getSimpleName());
            }
            return value;
        } catch (IOException e) {
            throw new ArtifactSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
