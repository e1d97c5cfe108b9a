package vpnmanager.core.service.auth;

import java.util.Locale;

/**
 * Keeps post-login redirect targets on this site.
 */
public final class RedirectTargets {

    private static final int MAX_LENGTH = 2048;

    private RedirectTargets() {}

    /**
     * Returns {@code target} if it is a safe local path, otherwise {@code /}.
     *
     * <p>Only absolute paths are accepted. Protocol-relative forms, backslashes
     * (browsers normalize them to slashes), embedded schemes or credentials, and
     * encoded slashes are rejected.
     */
    public static String sanitize(String target) {
        if (target == null || target.isBlank() || target.length() > MAX_LENGTH) {
            return "/";
        }
        final var normalized = target.trim();
        if (!normalized.startsWith("/") || normalized.startsWith("//")) {
            return "/";
        }
        final var lower = normalized.toLowerCase(Locale.ROOT);
        if (normalized.contains("\\")
                || normalized.contains("@")
                || normalized.contains("://")
                || lower.contains("%2f")
                || lower.contains("%5c")
                || normalized.chars().anyMatch(Character::isISOControl)) {
            return "/";
        }
        return normalized;
    }
}
