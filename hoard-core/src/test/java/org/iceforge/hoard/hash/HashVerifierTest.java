package org.iceforge.hoard.hash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HashVerifierTest {

    // sha256("abc")
    private static final String ABC = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    private final HashVerifier hasher = new HashVerifier();

    @TempDir
    Path dir;

    @Test
    void hash_matchesKnownDigest() {
        assertEquals(ABC, hasher.hash("abc".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(ABC, HashVerifier.sha256Hex("abc"));
    }

    @Test
    void fileHash_equalsByteHash_acrossBlockBoundaries() throws Exception {
        byte[] data = new byte[4096 * 3 + 17];
        new Random(7).nextBytes(data);
        Path f = dir.resolve("blob");
        Files.write(f, data);

        assertEquals(hasher.hash(data), hasher.hash(f));
    }

    @Test
    void verify_detectsSingleByteChange() throws Exception {
        byte[] data = "model-bytes".getBytes(StandardCharsets.UTF_8);
        Path f = dir.resolve("m.blob");
        Files.write(f, data);
        String digest = hasher.hash(data);

        assertTrue(hasher.verify(f, digest));
        assertTrue(hasher.verify(f, digest.toUpperCase()));

        data[0] ^= 1;
        Files.write(f, data);
        assertFalse(hasher.verify(f, digest));
        assertFalse(hasher.verify(data, digest));
    }

    @Test
    void verify_blankExpected_isFalse() {
        assertFalse(hasher.verify(new byte[0], null));
        assertFalse(hasher.verify(new byte[0], " "));
    }

    @Test
    void verify_missingFile_throws() {
        assertThrows(NoSuchFileException.class, () -> hasher.verify(dir.resolve("nope"), ABC));
    }
}
