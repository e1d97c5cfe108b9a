package vpnmanager.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import vpnmanager.core.exception.CsrfException;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.out.SecurityMetrics;
import vpnmanager.fixtures.Fixtures;

@DisplayName("CsrfTokenService")
class CsrfTokenServiceTest {

    private SecurityMetrics metrics;
    private CsrfTokenService service;
    private Session alice;

    @BeforeEach
    void setUp() {
        metrics = mock(SecurityMetrics.class);
        service = new CsrfTokenService(metrics);
        alice = Fixtures.user("alice");
    }

    @Nested
    @DisplayName("tokenFor()")
    class TokenForTests {

        @Test
        @DisplayName("should be stable for the lifetime of a session")
        void shouldBeStable() {
            assertEquals(service.tokenFor(alice), service.tokenFor(alice));
        }

        @Test
        @DisplayName("should differ between sessions")
        void shouldDifferBetweenSessions() {
            assertNotEquals(service.tokenFor(alice), service.tokenFor(Fixtures.user("bob")));
        }

        @Test
        @DisplayName("should differ when the same secret is bound to another session id")
        void shouldBindToSessionId() {
            assertNotEquals(service.tokenFor(alice), service.tokenFor(alice.withId("other-id")));
        }
    }

    @Nested
    @DisplayName("verify()")
    class VerifyTests {

        @Test
        @DisplayName("should accept the session's token")
        void shouldAcceptValidToken() {
            assertDoesNotThrow(() -> service.verify(alice, service.tokenFor(alice)));
        }

        @Test
        @DisplayName("should reject missing token")
        void shouldRejectMissingToken() {
            var ex = assertThrows(CsrfException.class, () -> service.verify(alice, null));

            assertEquals(CsrfException.Reason.MISSING_TOKEN, ex.reason());
            verify(metrics).recordCsrfRejection("missing_token");
        }

        @Test
        @DisplayName("should reject a token issued to another session")
        void shouldRejectForeignToken() {
            var foreign = service.tokenFor(Fixtures.user("bob"));

            var ex = assertThrows(CsrfException.class, () -> service.verify(alice, foreign));

            assertEquals(CsrfException.Reason.TOKEN_MISMATCH, ex.reason());
        }

        @Test
        @DisplayName("should reject oversized token")
        void shouldRejectOversizedToken() {
            assertThrows(CsrfException.class, () -> service.verify(alice, "x".repeat(4096)));
        }
    }
}
