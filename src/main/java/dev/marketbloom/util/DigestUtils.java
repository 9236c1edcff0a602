package dev.marketbloom.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 helpers used for secret comparison.
 */
public final class DigestUtils {

    private DigestUtils() {
        // utility class
    }

    /**
     * Compute raw SHA-256 hash bytes.
     *
     * @param data bytes to hash
     * @return SHA-256 digest bytes
     */
    public static byte[] sha256(byte[] data) {
        Objects.requireNonNull(data, "Input must not be null");
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Compare two secrets in time independent of where they first differ.
     * Both sides are hashed first so the comparison does not leak the expected length.
     *
     * @return {@code false} if either side is {@code null}
     */
    public static boolean constantTimeEquals(String candidate, String expected) {
        if (candidate == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sha256(candidate.getBytes(StandardCharsets.UTF_8)),
                sha256(expected.getBytes(StandardCharsets.UTF_8)));
    }
}
