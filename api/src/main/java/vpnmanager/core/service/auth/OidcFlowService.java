package vpnmanager.core.service.auth;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.config.OidcConfig;
import vpnmanager.core.exception.AuthenticationException;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.auth.AuthorizationRedirect;
import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.auth.LoginResult;
import vpnmanager.core.model.auth.LogoutPlan;
import vpnmanager.core.model.auth.OidcExchange;
import vpnmanager.core.model.auth.OidcFlowState;
import vpnmanager.core.model.auth.OidcProviderMetadata;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.AuthenticationFlow;
import vpnmanager.core.port.in.SessionManagement;
import vpnmanager.core.port.out.IdTokenVerifier;
import vpnmanager.core.port.out.OidcExchangeRepository;
import vpnmanager.core.port.out.OidcProviderClient;
import vpnmanager.core.port.out.SecurityMetrics;
import vpnmanager.core.util.SecureHash;

/**
 * OIDC relying party: authorization code flow with nonce and PKCE, and two-stage logout.
 *
 * <p>Login moves an exchange through
 * {@code UNAUTHENTICATED -> REDIRECT_ISSUED -> CALLBACK_PENDING -> AUTHENTICATED},
 * or into {@code AUTH_FAILED}. The exchange is consumed atomically before anything
 * else happens on callback, so a state value can succeed at most once.
 *
 * <p>Logout terminates the provider session before the local one. The first stage
 * flags the local session so it can no longer authenticate; the second stage,
 * reached when the provider redirects back, deletes it.
 */
@ApplicationScoped
public class OidcFlowService implements AuthenticationFlow {

    private static final Logger LOG = Logger.getLogger(OidcFlowService.class);
    private static final int MAX_STATE_LENGTH = 512;
    private static final int MAX_CODE_LENGTH = 4096;
    private static final Pattern PROVIDER_ERROR_CODE = Pattern.compile("^[A-Za-z0-9_.-]{1,64}$");

    private final OidcProviderClient provider;
    private final IdTokenVerifier idTokenVerifier;
    private final OidcExchangeRepository exchanges;
    private final SessionManagement sessions;
    private final PkceService pkce;
    private final SecureTokenGenerator tokens;
    private final SecurityMetrics metrics;
    private final OidcConfig config;

    @Inject
    public OidcFlowService(
            OidcProviderClient provider,
            IdTokenVerifier idTokenVerifier,
            OidcExchangeRepository exchanges,
            SessionManagement sessions,
            PkceService pkce,
            SecureTokenGenerator tokens,
            SecurityMetrics metrics,
            OidcConfig config) {
        this.provider = provider;
        this.idTokenVerifier = idTokenVerifier;
        this.exchanges = exchanges;
        this.sessions = sessions;
        this.pkce = pkce;
        this.tokens = tokens;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<AuthorizationRedirect> beginLogin(String returnTo) {
        final var target = RedirectTargets.sanitize(returnTo);

        return provider.metadata().flatMap(metadata -> {
            final var now = Instant.now();
            final var verifier = pkce.generateCodeVerifier();
            final var exchange = new OidcExchange(
                    tokens.state(),
                    tokens.nonce(),
                    verifier,
                    pkce.generateChallenge(verifier),
                    target,
                    now,
                    now.plus(config.exchangeTtl()));

            final var location = authorizationUri(metadata, exchange);
            return exchanges.store(exchange).map(v -> {
                advance(OidcFlowState.UNAUTHENTICATED, OidcFlowState.REDIRECT_ISSUED, exchange.stateId());
                return new AuthorizationRedirect(location, exchange.stateId());
            });
        });
    }

    @Override
    public Uni<LoginResult> completeLogin(String code, String state) {
        if (state == null || state.isBlank() || state.length() > MAX_STATE_LENGTH) {
            return fail(AuthenticationException.invalidState());
        }
        if (code == null || code.isBlank()) {
            return Uni.createFrom().failure(ValidationException.malformed("code", "Authorization code is missing"));
        }
        if (code.length() > MAX_CODE_LENGTH) {
            return Uni.createFrom()
                    .failure(new ValidationException(
                            ValidationException.Reason.TOO_LONG, "code", "Authorization code is too long"));
        }

        return exchanges.consume(state).flatMap(exchangeOpt -> {
            if (exchangeOpt.isEmpty()) {
                LOG.warnf("Callback with unknown or consumed state %s", SecureHash.truncatedSha256(state, 12));
                return fail(AuthenticationException.invalidState());
            }
            final var exchange = exchangeOpt.get();
            advance(OidcFlowState.REDIRECT_ISSUED, OidcFlowState.CALLBACK_PENDING, state);
            return redeem(exchange, code);
        });
    }

    private Uni<LoginResult> redeem(OidcExchange exchange, String code) {
        return provider.metadata().flatMap(metadata -> provider.exchangeCode(metadata, code, exchange.codeVerifier())
                .flatMap(tokenResponse -> idTokenVerifier
                        .verify(tokenResponse.idToken(), metadata)
                        .flatMap(claims -> {
                            if (!nonceMatches(exchange, claims)) {
                                advance(OidcFlowState.CALLBACK_PENDING, OidcFlowState.AUTH_FAILED, exchange.stateId());
                                LOG.warnf("Nonce mismatch on callback for subject %s", claims.subject());
                                return fail(AuthenticationException.nonceMismatch());
                            }
                            return sessions.createSession(claims, tokenResponse.idToken())
                                    .map(session -> {
                                        advance(
                                                OidcFlowState.CALLBACK_PENDING,
                                                OidcFlowState.AUTHENTICATED,
                                                exchange.stateId());
                                        metrics.recordLogin();
                                        return new LoginResult(session, exchange.redirectTarget());
                                    });
                        })))
                .onFailure(UpstreamException.class)
                .invoke(e -> metrics.recordAuthFailure("upstream"));
    }

    @Override
    public Uni<LoginResult> rejectLogin(String state, String error) {
        final var errorCode = error != null && PROVIDER_ERROR_CODE.matcher(error).matches() ? error : "unknown_error";
        if (state == null || state.isBlank() || state.length() > MAX_STATE_LENGTH) {
            return fail(AuthenticationException.invalidState());
        }
        return exchanges.consume(state).flatMap(exchangeOpt -> {
            if (exchangeOpt.isEmpty()) {
                return fail(AuthenticationException.invalidState());
            }
            advance(OidcFlowState.REDIRECT_ISSUED, OidcFlowState.AUTH_FAILED, state);
            LOG.infof("Identity provider rejected login: %s", errorCode);
            metrics.recordAuthFailure("provider_rejected");
            return Uni.createFrom()
                    .failure(UpstreamException.rejected(
                            "identity provider", "Login was rejected by the identity provider (%s)".formatted(errorCode)));
        });
    }

    @Override
    public Uni<LogoutPlan> beginLogout(String sessionId) {
        return sessions.markLogoutPending(sessionId).flatMap(sessionOpt -> {
            if (sessionOpt.isEmpty()) {
                return Uni.createFrom().item(LogoutPlan.local());
            }
            final var session = sessionOpt.get();
            return provider.metadata().flatMap(metadata -> {
                final var endSession = metadata.endSessionEndpoint();
                if (endSession.isEmpty()) {
                    LOG.debugf("Provider has no end_session_endpoint, logging %s out locally", session.subject());
                    return sessions.invalidateSession(sessionId).replaceWith(LogoutPlan.local());
                }
                LOG.infof("Starting provider logout for %s", session.subject());
                return Uni.createFrom().item(LogoutPlan.viaProvider(endSessionUri(endSession.get(), session)));
            });
        });
    }

    @Override
    public Uni<LogoutPlan> completeLogout(String sessionId) {
        return sessions.find(sessionId).flatMap(sessionOpt -> {
            if (sessionOpt.isPresent() && !sessionOpt.get().logoutPending()) {
                // Provider logout has not happened yet for this session.
                return beginLogout(sessionId);
            }
            return sessions.invalidateSession(sessionId).replaceWith(LogoutPlan.local());
        });
    }

    private boolean nonceMatches(OidcExchange exchange, IdTokenClaims claims) {
        return SecureHash.constantTimeEquals(exchange.nonce(), claims.nonce());
    }

    private URI authorizationUri(OidcProviderMetadata metadata, OidcExchange exchange) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.clientId());
        params.put("redirect_uri", config.redirectUri());
        params.put("response_type", "code");
        params.put("scope", config.scopes());
        params.put("state", exchange.stateId());
        params.put("nonce", exchange.nonce());
        params.put("code_challenge", exchange.codeChallenge());
        params.put("code_challenge_method", PkceService.S256_METHOD);
        return withQuery(metadata.authorizationEndpoint(), params);
    }

    private URI endSessionUri(String endpoint, Session session) {
        final Map<String, String> params = new LinkedHashMap<>();
        if (session.idTokenHint() != null) {
            params.put("id_token_hint", session.idTokenHint());
        }
        params.put("client_id", config.clientId());
        config.postLogoutRedirectUri().ifPresent(uri -> params.put("post_logout_redirect_uri", uri));
        return withQuery(endpoint, params);
    }

    private static URI withQuery(String endpoint, Map<String, String> params) {
        final var query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        final var separator = endpoint.contains("?") ? "&" : "?";
        return URI.create(endpoint + separator + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(Optional.ofNullable(value).orElse(""), StandardCharsets.UTF_8);
    }

    private static void advance(OidcFlowState from, OidcFlowState to, String stateId) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal login transition %s -> %s".formatted(from, to));
        }
        LOG.debugf("Login %s: %s -> %s", SecureHash.truncatedSha256(stateId, 8), from, to);
    }

    private <T> Uni<T> fail(AuthenticationException e) {
        metrics.recordAuthFailure(e.reason().name().toLowerCase());
        return Uni.createFrom().failure(e);
    }
}
