package org.iceforge.hoard.serial;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RawBytesSerializerTest {

    private final RawBytesSerializer serializer = new RawBytesSerializer();

    @Test
    void serialize_copiesInput() throws Exception {
        byte[] in = {1, 2, 3};
        byte[] out = serializer.serialize(in);
        in[0] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, out);
        assertEquals(RawBytesSerializer.TYPE_TAG, serializer.typeTag());
    }

    @Test
    void null_isRejected() {
        assertThrows(ArtifactSerializationException.class, () -> serializer.serialize(null));
        assertThrows(ArtifactSerializationException.class, () -> serializer.deserialize(null));
    }
}
