package vpnmanager.core.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Certificate fingerprint computation and parsing.
 *
 * <p>A fingerprint is the lowercase hex SHA-256 of the certificate's DER encoding.
 */
public final class Fingerprints {

    public static final int LENGTH = 64;

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");

    private Fingerprints() {}

    public static String of(byte[] der) {
        return SecureHash.sha256Hex(der);
    }

    /**
     * Normalizes user input into a fingerprint.
     *
     * <p>Accepts upper or lower case and colon separated octets.
     *
     * @return the canonical fingerprint, or empty if the input cannot be one
     */
    public static Optional<String> parse(String input) {
        if (input == null || input.length() > LENGTH * 2) {
            return Optional.empty();
        }
        final var normalized = input.trim().replace(":", "").toLowerCase(Locale.ROOT);
        return HEX_64.matcher(normalized).matches() ? Optional.of(normalized) : Optional.empty();
    }

    /**
     * Short prefix for log lines.
     */
    public static String abbreviate(String fingerprint) {
        return fingerprint == null || fingerprint.length() < 12
                ? String.valueOf(fingerprint)
                : fingerprint.substring(0, 12);
    }
}
