package vpnmanager.adapter.in.auth;

import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpServerRequest;

import vpnmanager.core.config.SessionConfig;
import vpnmanager.core.model.session.Session;

/**
 * Manages session cookies - creation, extraction, and invalidation.
 *
 * <p>Session cookies carry no Max-Age; they end with the browser session or the
 * server-side expiry, whichever comes first.
 */
@ApplicationScoped
public class SessionCookieManager {

    private final SessionConfig config;

    @Inject
    public SessionCookieManager(SessionConfig config) {
        this.config = config;
    }

    /**
     * Creates the session cookie for a new session.
     */
    public NewCookie createCookie(Session session) {
        return baseCookie(session.id()).build();
    }

    /**
     * Creates a cookie that clears the session immediately.
     */
    public NewCookie createLogoutCookie() {
        return baseCookie("").maxAge(0).build();
    }

    private NewCookie.Builder baseCookie(String value) {
        final var cookie = config.cookie();
        final var builder = new NewCookie.Builder(cookie.name())
                .value(value)
                .path(cookie.path())
                .secure(cookie.secure())
                .httpOnly(true)
                .sameSite(parseSameSite(cookie.sameSite()));
        cookie.domain().ifPresent(builder::domain);
        return builder;
    }

    /**
     * Extracts the session ID from a request's cookies.
     *
     * @param request The HTTP request
     * @return The session ID, or empty if not present
     */
    public Optional<String> extractSessionId(HttpServerRequest request) {
        Cookie cookie = request.getCookie(config.cookie().name());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public String getCookieName() {
        return config.cookie().name();
    }

    static NewCookie.SameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
