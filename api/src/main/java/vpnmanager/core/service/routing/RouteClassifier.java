package vpnmanager.core.service.routing;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import vpnmanager.core.model.routing.RouteScope;

/**
 * Classifies request paths into capability scopes.
 *
 * <p>Prefixes match whole path segments, so {@code /administrator} is not under {@code /admin}.
 * Paths are classified in the form resources are matched against: percent-escapes decoded,
 * matrix parameters dropped, and empty and dot segments resolved. A path such as
 * {@code /%61dmin;x=1/psk} therefore lands in the same scope as {@code /admin/psk}.
 */
public final class RouteClassifier {

    private static final List<String> ADMIN_PREFIXES =
            List.of("/admin", "/certificates", "/api/v1/server", "/api/v1/computer");
    private static final List<String> USER_PREFIXES = List.of("/profile", "/api/v1/profile");

    private RouteClassifier() {}

    public static RouteScope classify(String path) {
        final var normalized = canonical(path);
        if (matchesAny(normalized, ADMIN_PREFIXES)) {
            return RouteScope.ADMIN;
        }
        if (matchesAny(normalized, USER_PREFIXES)) {
            return RouteScope.USER;
        }
        return RouteScope.COMMON;
    }

    /**
     * Whether the path is a machine API rather than a browser page.
     */
    public static boolean isApiPath(String path) {
        return underPrefix(canonical(path), "/api");
    }

    private static boolean matchesAny(String path, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (underPrefix(path, prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean underPrefix(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    static String canonical(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        final Deque<String> segments = new ArrayDeque<>();
        for (String segment : decode(rawPath).split("/")) {
            final int matrix = segment.indexOf(';');
            final var name = matrix >= 0 ? segment.substring(0, matrix) : segment;
            if (name.isEmpty() || ".".equals(name)) {
                continue;
            }
            if ("..".equals(name)) {
                segments.pollLast();
                continue;
            }
            segments.addLast(name);
        }
        return "/" + String.join("/", segments);
    }

    // '+' is literal in a path.
    private static String decode(String rawPath) {
        if (rawPath.indexOf('%') < 0) {
            return rawPath;
        }
        try {
            return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return rawPath;
        }
    }
}
