package vpnmanager.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for hashing secrets and sensitive identifiers.
 *
 * <p>Used to store pre-shared keys, fingerprint certificates, and log identifiers
 * such as session ids without exposing them.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Full lowercase SHA-256 hex digest of a UTF-8 string.
     */
    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Full lowercase SHA-256 hex digest of raw bytes.
     */
    public static String sha256Hex(byte[] input) {
        return HexFormat.of().formatHex(sha256(input));
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * <p>Suitable for log lines that must correlate a value without revealing it.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        if (input == null) {
            return "none";
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Compares two strings without short-circuiting on the first differing byte.
     *
     * @return false if either argument is null
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every Java platform", e);
        }
    }
}
