package vpnmanager.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import jakarta.ws.rs.core.NewCookie;

import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpServerRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import vpnmanager.core.config.SessionConfig;
import vpnmanager.fixtures.Fixtures;

@DisplayName("SessionCookieManager")
class SessionCookieManagerTest {

    private SessionConfig.CookieConfig cookieConfig;
    private SessionCookieManager manager;

    @BeforeEach
    void setUp() {
        var config = mock(SessionConfig.class);
        cookieConfig = mock(SessionConfig.CookieConfig.class);
        when(config.cookie()).thenReturn(cookieConfig);
        when(cookieConfig.name()).thenReturn("vpn_session");
        when(cookieConfig.path()).thenReturn("/");
        when(cookieConfig.secure()).thenReturn(true);
        when(cookieConfig.sameSite()).thenReturn("Lax");
        when(cookieConfig.domain()).thenReturn(Optional.empty());

        manager = new SessionCookieManager(config);
    }

    @Nested
    @DisplayName("createCookie()")
    class CreateCookieTests {

        @Test
        @DisplayName("should create a secure HttpOnly session cookie without Max-Age")
        void shouldCreateSecureSessionCookie() {
            var session = Fixtures.user("alice");

            var cookie = manager.createCookie(session);

            assertEquals("vpn_session", cookie.getName());
            assertEquals(session.id(), cookie.getValue());
            assertEquals("/", cookie.getPath());
            assertTrue(cookie.isSecure());
            assertTrue(cookie.isHttpOnly());
            assertEquals(NewCookie.SameSite.LAX, cookie.getSameSite());
            assertEquals(NewCookie.DEFAULT_MAX_AGE, cookie.getMaxAge());
        }

        @Test
        @DisplayName("should scope the cookie to a configured domain")
        void shouldScopeToDomain() {
            when(cookieConfig.domain()).thenReturn(Optional.of("vpn.example.com"));

            var cookie = manager.createCookie(Fixtures.user("alice"));

            assertEquals("vpn.example.com", cookie.getDomain());
        }
    }

    @Test
    @DisplayName("should expire the cookie immediately on logout")
    void shouldExpireOnLogout() {
        var cookie = manager.createLogoutCookie();

        assertEquals("", cookie.getValue());
        assertEquals(0, cookie.getMaxAge());
    }

    @Nested
    @DisplayName("extractSessionId()")
    class ExtractSessionIdTests {

        @Test
        @DisplayName("should read the session cookie")
        void shouldReadCookie() {
            var request = mock(HttpServerRequest.class);
            when(request.getCookie("vpn_session")).thenReturn(Cookie.cookie("vpn_session", "abc"));

            assertEquals(Optional.of("abc"), manager.extractSessionId(request));
        }

        @Test
        @DisplayName("should return empty for a missing or blank cookie")
        void shouldReturnEmptyForMissingCookie() {
            var request = mock(HttpServerRequest.class);
            assertFalse(manager.extractSessionId(request).isPresent());

            when(request.getCookie("vpn_session")).thenReturn(Cookie.cookie("vpn_session", " "));
            assertFalse(manager.extractSessionId(request).isPresent());
        }
    }

    @Test
    @DisplayName("should parse SameSite values case-insensitively")
    void shouldParseSameSite() {
        assertEquals(NewCookie.SameSite.STRICT, SessionCookieManager.parseSameSite("strict"));
        assertEquals(NewCookie.SameSite.NONE, SessionCookieManager.parseSameSite("None"));
        assertEquals(NewCookie.SameSite.LAX, SessionCookieManager.parseSameSite("whatever"));
    }
}
