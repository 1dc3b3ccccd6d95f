package net.seanstash.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for content addressing.
 */
public final class HashUtils {

    private static final String ALGORITHM = "SHA-256";

    private HashUtils() {
    }

    /**
     * Computes the SHA-256 digest of the UTF-8 bytes of {@code data}.
     *
     * @return lowercase hex string (64 characters)
     */
    public static String sha256Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return HexFormat.of().formatHex(computeSha256(data.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * First eight bytes of the SHA-256 digest as a signed long, for Postgres advisory lock keys.
     */
    public static long sha256Prefix64(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return ByteBuffer.wrap(computeSha256(data.getBytes(StandardCharsets.UTF_8))).getLong();
    }

    static byte[] computeSha256(byte[] data) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException(ALGORITHM + " is unavailable in this JVM", exception);
        }
    }
}
