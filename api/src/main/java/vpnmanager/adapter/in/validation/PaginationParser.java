package vpnmanager.adapter.in.validation;

/**
 * Lenient parsing of {@code page} and {@code limit} query parameters.
 *
 * <p>Nothing a client sends here produces an error. Unusable values fall back and
 * the core clamps the rest.
 */
public final class PaginationParser {

    /** Sentinel asking the core for its default page size. */
    public static final int DEFAULT_SIZE = 0;

    private static final int MAX_DIGITS = 9;

    private PaginationParser() {}

    /**
     * @return the page number, or 1 if absent, non-numeric or below 1
     */
    public static int page(String raw) {
        final int parsed = parse(raw, 1);
        return parsed < 1 ? 1 : parsed;
    }

    /**
     * @return the page size, or {@link #DEFAULT_SIZE} if absent, non-numeric or below 1
     */
    public static int size(String raw) {
        final int parsed = parse(raw, DEFAULT_SIZE);
        return parsed < 1 ? DEFAULT_SIZE : parsed;
    }

    private static int parse(String raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        final var trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return fallback;
        }
        // Signs, decimals and anything else non-numeric fall back
        if (!trimmed.chars().allMatch(Character::isDigit)) {
            return fallback;
        }
        final var digits = trimmed;
        // Larger values saturate
        if (digits.length() > MAX_DIGITS) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(digits);
    }
}
