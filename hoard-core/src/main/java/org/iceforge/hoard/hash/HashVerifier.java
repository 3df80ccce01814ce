package org.iceforge.hoard.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Content digests for stored blobs. Digests are lower-case hex SHA-256.
 */
public final class HashVerifier {

    private static final String ALGORITHM = "SHA-256";
    private static final int BLOCK_SIZE = 4096;

    public String hash(byte[] blob) {
        Objects.requireNonNull(blob, "blob");
        return HexFormat.of().formatHex(newDigest().digest(blob));
    }

    public String hash(Path blob) throws IOException {
        Objects.requireNonNull(blob, "blob");
        MessageDigest md = newDigest();
        byte[] buf = new byte[BLOCK_SIZE];
        try (InputStream in = Files.newInputStream(blob)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                md.update(buf, 0, n);
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /**
     * Recomputes the digest of {@code blob} and compares it with {@code expected}.
     *
     * @throws java.nio.file.NoSuchFileException if the blob is gone
     */
    public boolean verify(Path blob, String expected) throws IOException {
        if (expected == null || expected.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
                hash(blob).getBytes(StandardCharsets.US_ASCII),
                expected.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }

    public boolean verify(byte[] blob, String expected) {
        if (expected == null || expected.isBlank()) {
            return false;
        }
        return hash(blob).equalsIgnoreCase(expected);
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }

    /** Hex SHA-256 of a UTF-8 string; used for identity keys rather than blob integrity. */
    public static String sha256Hex(String s) {
        byte[] dig = newDigest().digest(s.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(dig);
    }
}
