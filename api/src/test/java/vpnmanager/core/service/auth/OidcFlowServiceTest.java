package vpnmanager.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import vpnmanager.adapter.out.storage.memory.InMemoryOidcExchangeRepository;
import vpnmanager.core.config.OidcConfig;
import vpnmanager.core.exception.AuthenticationException;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.auth.LoginResult;
import vpnmanager.core.model.auth.OidcProviderMetadata;
import vpnmanager.core.model.auth.OidcTokenResponse;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.SessionManagement;
import vpnmanager.core.port.out.IdTokenVerifier;
import vpnmanager.core.port.out.OidcProviderClient;
import vpnmanager.core.port.out.SecurityMetrics;
import vpnmanager.fixtures.Fixtures;

@DisplayName("OidcFlowService")
class OidcFlowServiceTest {

    private static final OidcProviderMetadata METADATA = new OidcProviderMetadata(
            "https://idp.example.com",
            "https://idp.example.com/authorize",
            "https://idp.example.com/token",
            "https://idp.example.com/jwks",
            Optional.of("https://idp.example.com/logout"));

    private OidcProviderClient provider;
    private IdTokenVerifier verifier;
    private InMemoryOidcExchangeRepository exchanges;
    private SessionManagement sessions;
    private SecurityMetrics metrics;
    private OidcConfig config;
    private PkceService pkce;
    private OidcFlowService service;

    @BeforeEach
    void setUp() {
        provider = mock(OidcProviderClient.class);
        verifier = mock(IdTokenVerifier.class);
        sessions = mock(SessionManagement.class);
        metrics = mock(SecurityMetrics.class);
        config = mock(OidcConfig.class);
        exchanges = new InMemoryOidcExchangeRepository();
        pkce = new PkceService();

        when(config.clientId()).thenReturn("vpn-manager");
        when(config.redirectUri()).thenReturn("https://vpn.example.com/auth/callback");
        when(config.scopes()).thenReturn("openid profile email");
        when(config.exchangeTtl()).thenReturn(Duration.ofMinutes(10));
        when(config.postLogoutRedirectUri()).thenReturn(Optional.of("https://vpn.example.com/auth/logout/complete"));
        when(provider.metadata()).thenReturn(Uni.createFrom().item(METADATA));

        service = new OidcFlowService(
                provider, verifier, exchanges, sessions, pkce, new SecureTokenGenerator(), metrics, config);
    }

    @AfterEach
    void tearDown() {
        exchanges.shutdown();
    }

    private static Map<String, String> query(URI uri) {
        final Map<String, String> params = new LinkedHashMap<>();
        for (String pair : uri.getRawQuery().split("&")) {
            final var idx = pair.indexOf('=');
            params.put(
                    URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
        }
        return params;
    }

    private Map<String, String> begin(String returnTo) {
        return query(service.beginLogin(returnTo).await().indefinitely().location());
    }

    private void providerIssuesToken(String nonce) {
        when(provider.exchangeCode(eq(METADATA), anyString(), anyString()))
                .thenReturn(Uni.createFrom().item(new OidcTokenResponse("raw-id-token", "at", "Bearer", 300)));
        when(verifier.verify("raw-id-token", METADATA))
                .thenReturn(Uni.createFrom()
                        .item(new IdTokenClaims("alice", nonce, "Alice", "alice@example.com", List.of("staff"))));
        when(sessions.createSession(any(), eq("raw-id-token")))
                .thenReturn(Uni.createFrom().item(Fixtures.user("alice")));
    }

    @Nested
    @DisplayName("beginLogin()")
    class BeginLoginTests {

        @Test
        @DisplayName("should build authorization URL with state, nonce and S256 challenge")
        void shouldBuildAuthorizationUrl() {
            var redirect = service.beginLogin("/profile").await().indefinitely();
            var params = query(redirect.location());

            assertTrue(redirect.location().toString().startsWith("https://idp.example.com/authorize?"));
            assertEquals("code", params.get("response_type"));
            assertEquals("vpn-manager", params.get("client_id"));
            assertEquals("https://vpn.example.com/auth/callback", params.get("redirect_uri"));
            assertEquals("openid profile email", params.get("scope"));
            assertEquals(redirect.stateId(), params.get("state"));
            assertEquals("S256", params.get("code_challenge_method"));
            assertTrue(params.get("nonce").length() >= 43);
            assertTrue(params.get("code_challenge").length() >= 43);
            assertEquals(1, exchanges.getExchangeCount());
        }

        @Test
        @DisplayName("should issue distinct state and nonce per login")
        void shouldIssueDistinctValues() {
            var first = begin("/");
            var second = begin("/");

            assertFalse(first.get("state").equals(second.get("state")));
            assertFalse(first.get("nonce").equals(second.get("nonce")));
        }
    }

    @Nested
    @DisplayName("completeLogin()")
    class CompleteLoginTests {

        @Test
        @DisplayName("should create session and return sanitized redirect target")
        void shouldCompleteLogin() {
            var params = begin("/profile/certificates");
            providerIssuesToken(params.get("nonce"));

            LoginResult result =
                    service.completeLogin("auth-code", params.get("state")).await().indefinitely();

            assertEquals("alice", result.session().subject());
            assertEquals("/profile/certificates", result.redirectTarget());
            verify(metrics).recordLogin();
        }

        @Test
        @DisplayName("should send the verifier matching the published challenge")
        void shouldSendMatchingVerifier() {
            var params = begin("/");
            providerIssuesToken(params.get("nonce"));

            service.completeLogin("auth-code", params.get("state")).await().indefinitely();

            var verifierCaptor = ArgumentCaptor.forClass(String.class);
            verify(provider).exchangeCode(eq(METADATA), eq("auth-code"), verifierCaptor.capture());
            assertTrue(pkce.matches(verifierCaptor.getValue(), params.get("code_challenge")));
        }

        @Test
        @DisplayName("should redirect to root when the return target was unsafe")
        void shouldSanitizeReturnTarget() {
            var params = begin("https://evil.example.com/");
            providerIssuesToken(params.get("nonce"));

            var result = service.completeLogin("auth-code", params.get("state")).await().indefinitely();

            assertEquals("/", result.redirectTarget());
        }

        @Test
        @DisplayName("should accept a state only once")
        void shouldConsumeStateOnce() {
            var params = begin("/");
            providerIssuesToken(params.get("nonce"));

            service.completeLogin("auth-code", params.get("state")).await().indefinitely();
            var second = assertThrows(AuthenticationException.class, () -> service.completeLogin(
                            "auth-code", params.get("state"))
                    .await()
                    .indefinitely());

            assertEquals(AuthenticationException.Reason.INVALID_STATE, second.reason());
            verify(provider, times(1)).exchangeCode(any(), anyString(), anyString());
        }

        @Test
        @DisplayName("should let exactly one of two concurrent callbacks succeed")
        void shouldAllowOneConcurrentCallback() throws Exception {
            var params = begin("/");
            providerIssuesToken(params.get("nonce"));
            var state = params.get("state");

            var pool = Executors.newFixedThreadPool(2);
            var start = new CountDownLatch(1);
            Callable<LoginResult> callback = () -> {
                start.await();
                return service.completeLogin("auth-code", state).await().indefinitely();
            };
            try {
                List<Future<LoginResult>> futures = new ArrayList<>();
                futures.add(pool.submit(callback));
                futures.add(pool.submit(callback));
                start.countDown();

                int successes = 0;
                int invalidStates = 0;
                for (Future<LoginResult> future : futures) {
                    try {
                        future.get();
                        successes++;
                    } catch (ExecutionException e) {
                        assertTrue(e.getCause() instanceof AuthenticationException);
                        invalidStates++;
                    }
                }
                assertEquals(1, successes);
                assertEquals(1, invalidStates);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("should reject unknown state without contacting the provider")
        void shouldRejectUnknownState() {
            var ex = assertThrows(AuthenticationException.class, () -> service.completeLogin("code", "forged")
                    .await()
                    .indefinitely());

            assertEquals(AuthenticationException.Reason.INVALID_STATE, ex.reason());
            verify(provider, never()).exchangeCode(any(), anyString(), anyString());
            verify(metrics).recordAuthFailure("invalid_state");
        }

        @Test
        @DisplayName("should reject missing and oversized state")
        void shouldRejectMalformedState() {
            assertThrows(AuthenticationException.class, () -> service.completeLogin("code", null)
                    .await()
                    .indefinitely());
            assertThrows(AuthenticationException.class, () -> service.completeLogin("code", "s".repeat(513))
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("should reject missing code as malformed input")
        void shouldRejectMissingCode() {
            var params = begin("/");

            assertThrows(ValidationException.class, () -> service.completeLogin(" ", params.get("state"))
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("should reject expired exchange")
        void shouldRejectExpiredExchange() {
            when(config.exchangeTtl()).thenReturn(Duration.ofSeconds(-1));
            var params = begin("/");

            var ex = assertThrows(AuthenticationException.class, () -> service.completeLogin(
                            "code", params.get("state"))
                    .await()
                    .indefinitely());

            assertEquals(AuthenticationException.Reason.INVALID_STATE, ex.reason());
        }

        @Test
        @DisplayName("should reject ID token carrying a different nonce")
        void shouldRejectNonceMismatch() {
            var params = begin("/");
            providerIssuesToken("some-other-nonce");

            var ex = assertThrows(AuthenticationException.class, () -> service.completeLogin(
                            "code", params.get("state"))
                    .await()
                    .indefinitely());

            assertEquals(AuthenticationException.Reason.NONCE_MISMATCH, ex.reason());
            verify(sessions, never()).createSession(any(), anyString());
        }

        @Test
        @DisplayName("should propagate provider rejection of the code")
        void shouldPropagateProviderRejection() {
            var params = begin("/");
            when(provider.exchangeCode(any(), anyString(), anyString()))
                    .thenReturn(Uni.createFrom().failure(UpstreamException.rejected("identity provider", "bad code")));

            assertThrows(UpstreamException.class, () -> service.completeLogin("code", params.get("state"))
                    .await()
                    .indefinitely());
            verify(metrics).recordAuthFailure("upstream");
        }
    }

    @Nested
    @DisplayName("rejectLogin()")
    class RejectLoginTests {

        @Test
        @DisplayName("should consume state and report provider rejection")
        void shouldConsumeStateOnProviderError() {
            var params = begin("/");

            var ex = assertThrows(UpstreamException.class, () -> service.rejectLogin(
                            params.get("state"), "access_denied")
                    .await()
                    .indefinitely());

            assertTrue(ex.getMessage().contains("access_denied"));
            assertEquals(0, exchanges.getExchangeCount());
        }

        @Test
        @DisplayName("should not echo unexpected error codes")
        void shouldNotEchoUnexpectedErrors() {
            var params = begin("/");

            var ex = assertThrows(UpstreamException.class, () -> service.rejectLogin(
                            params.get("state"), "<script>")
                    .await()
                    .indefinitely());

            assertFalse(ex.getMessage().contains("<script>"));
        }
    }

    @Nested
    @DisplayName("logout")
    class LogoutTests {

        @Test
        @DisplayName("should send browser to provider end session endpoint with id_token_hint")
        void shouldStartProviderLogout() {
            Session session = Fixtures.user("alice");
            when(sessions.markLogoutPending(session.id()))
                    .thenReturn(Uni.createFrom().item(Optional.of(session.asLogoutPending())));

            var plan = service.beginLogout(session.id()).await().indefinitely();

            assertTrue(plan.providerLogout().isPresent());
            var params = query(plan.providerLogout().get());
            assertEquals("id-token-alice", params.get("id_token_hint"));
            assertEquals("https://vpn.example.com/auth/logout/complete", params.get("post_logout_redirect_uri"));
            verify(sessions, never()).invalidateSession(anyString());
        }

        @Test
        @DisplayName("should log out locally when the provider has no end session endpoint")
        void shouldLogoutLocallyWithoutEndSession() {
            Session session = Fixtures.user("alice");
            when(provider.metadata())
                    .thenReturn(Uni.createFrom()
                            .item(new OidcProviderMetadata(
                                    METADATA.issuer(),
                                    METADATA.authorizationEndpoint(),
                                    METADATA.tokenEndpoint(),
                                    METADATA.jwksUri(),
                                    Optional.empty())));
            when(sessions.markLogoutPending(session.id()))
                    .thenReturn(Uni.createFrom().item(Optional.of(session.asLogoutPending())));
            when(sessions.invalidateSession(session.id())).thenReturn(Uni.createFrom().voidItem());

            var plan = service.beginLogout(session.id()).await().indefinitely();

            assertTrue(plan.providerLogout().isEmpty());
            verify(sessions).invalidateSession(session.id());
        }

        @Test
        @DisplayName("should delete the pending session when the provider sends the browser back")
        void shouldCompleteLogout() {
            Session pending = Fixtures.user("alice").asLogoutPending();
            when(sessions.find(pending.id())).thenReturn(Uni.createFrom().item(Optional.of(pending)));
            when(sessions.invalidateSession(pending.id())).thenReturn(Uni.createFrom().voidItem());

            var plan = service.completeLogout(pending.id()).await().indefinitely();

            assertTrue(plan.providerLogout().isEmpty());
            verify(sessions).invalidateSession(pending.id());
        }

        @Test
        @DisplayName("should not skip provider logout for an active session")
        void shouldNotSkipProviderLogout() {
            Session active = Fixtures.user("alice");
            when(sessions.find(active.id())).thenReturn(Uni.createFrom().item(Optional.of(active)));
            when(sessions.markLogoutPending(active.id()))
                    .thenReturn(Uni.createFrom().item(Optional.of(active.asLogoutPending())));

            var plan = service.completeLogout(active.id()).await().indefinitely();

            assertTrue(plan.providerLogout().isPresent());
            verify(sessions, never()).invalidateSession(anyString());
        }
    }
}
