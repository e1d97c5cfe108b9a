package vpnmanager.adapter.out.oidc;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import vpnmanager.core.cache.CaffeineLocalCache;
import vpnmanager.core.cache.LocalCache;
import vpnmanager.core.config.OidcConfig;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.model.auth.OidcProviderMetadata;
import vpnmanager.core.model.auth.OidcTokenResponse;
import vpnmanager.core.port.out.OidcProviderClient;

/**
 * OIDC provider client using the Vert.x web client.
 *
 * <p>Discovery metadata is cached and concurrent misses share one fetch. Discovery is
 * an idempotent read and is retried once; the code exchange is never retried because
 * authorization codes are single use.
 *
 * <p>Supports {@code client_secret_basic} and {@code client_secret_post} client
 * authentication, and public clients relying on PKCE alone.
 */
@ApplicationScoped
public class HttpOidcProviderClient implements OidcProviderClient {

    private static final Logger LOG = Logger.getLogger(HttpOidcProviderClient.class);
    private static final String UPSTREAM = "identity provider";
    private static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    private final WebClient webClient;
    private final OidcConfig config;
    private final LocalCache<String, OidcProviderMetadata> cache;
    private final AtomicReference<Uni<OidcProviderMetadata>> inFlight = new AtomicReference<>();

    @Inject
    public HttpOidcProviderClient(Vertx vertx, OidcConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.cache = new CaffeineLocalCache<>(config.metadataCacheTtl(), 4);
    }

    @Override
    public Uni<OidcProviderMetadata> metadata() {
        final var url = discoveryUrl();
        final var cached = cache.get(url);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        return Uni.createFrom().deferred(() -> inFlight.updateAndGet(current -> current != null
                ? current
                : fetchMetadata(url)
                        .onTermination()
                        .invoke(() -> inFlight.set(null))
                        .memoize()
                        .indefinitely()));
    }

    private Uni<OidcProviderMetadata> fetchMetadata(String url) {
        LOG.infof("Fetching OIDC discovery document from %s", url);
        return bounded(webClient.getAbs(url).timeout(timeoutMillis()).send())
                .map(this::parseMetadata)
                .onFailure()
                .retry()
                .atMost(1)
                .invoke(metadata -> cache.put(url, metadata))
                .onFailure(e -> !(e instanceof UpstreamException))
                .transform(e -> {
                    if (e instanceof TimeoutException) {
                        return UpstreamException.timeout(UPSTREAM);
                    }
                    LOG.errorf(e, "OIDC discovery failed");
                    return UpstreamException.rejected(UPSTREAM, "Identity provider discovery failed");
                });
    }

    private OidcProviderMetadata parseMetadata(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw UpstreamException.rejected(
                    UPSTREAM, "Discovery endpoint returned status " + response.statusCode());
        }
        final JsonObject json = response.bodyAsJsonObject();
        final var issuer = json.getString("issuer");
        final var authorizationEndpoint = json.getString("authorization_endpoint");
        final var tokenEndpoint = json.getString("token_endpoint");
        final var jwksUri = json.getString("jwks_uri");
        if (issuer == null || authorizationEndpoint == null || tokenEndpoint == null || jwksUri == null) {
            throw UpstreamException.rejected(UPSTREAM, "Discovery document is incomplete");
        }
        if (!issuer.equals(config.issuer())) {
            LOG.warnf("Discovery issuer %s differs from configured issuer %s", issuer, config.issuer());
        }
        return new OidcProviderMetadata(
                issuer,
                authorizationEndpoint,
                tokenEndpoint,
                jwksUri,
                Optional.ofNullable(json.getString("end_session_endpoint")));
    }

    @Override
    public Uni<OidcTokenResponse> exchangeCode(OidcProviderMetadata metadata, String code, String codeVerifier) {
        LOG.debugf("Exchanging authorization code at %s", metadata.tokenEndpoint());

        var request = webClient
                .postAbs(metadata.tokenEndpoint())
                .timeout(timeoutMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json");

        final var secret = config.clientSecret().filter(s -> !s.isBlank());
        if (secret.isPresent() && isBasicAuth()) {
            final var credentials = urlEncode(config.clientId()) + ":" + urlEncode(secret.get());
            final var encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
            request = request.putHeader("Authorization", "Basic " + encoded);
        }

        return bounded(request.sendBuffer(Buffer.buffer(formBody(code, codeVerifier, secret))))
                .map(this::parseTokenResponse)
                .onFailure(e -> !(e instanceof UpstreamException))
                .transform(e -> {
                    if (e instanceof TimeoutException) {
                        LOG.warnf("Token exchange timed out after %s", config.timeout());
                        return UpstreamException.timeout(UPSTREAM);
                    }
                    LOG.errorf(e, "Token exchange failed");
                    return UpstreamException.rejected(UPSTREAM, "Token exchange with the identity provider failed");
                });
    }

    private String formBody(String code, String codeVerifier, Optional<String> secret) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("redirect_uri", config.redirectUri());
        params.put("code_verifier", codeVerifier);
        params.put("client_id", config.clientId());
        if (secret.isPresent() && !isBasicAuth()) {
            params.put("client_secret", secret.get());
        }
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private OidcTokenResponse parseTokenResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.warnf("Token endpoint returned status %d", response.statusCode());
            throw UpstreamException.rejected(UPSTREAM, "Identity provider rejected the authorization code");
        }
        final JsonObject json = response.bodyAsJsonObject();
        final var idToken = json.getString("id_token");
        if (idToken == null || idToken.isBlank()) {
            throw UpstreamException.rejected(UPSTREAM, "Identity provider response is missing id_token");
        }
        return new OidcTokenResponse(
                idToken,
                json.getString("access_token"),
                json.getString("token_type", "Bearer"),
                json.getLong("expires_in", 0L));
    }

    private <T> Uni<T> bounded(Uni<T> call) {
        final Duration timeout = config.timeout();
        return call.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnf("Identity provider did not answer within %s", timeout);
            return UpstreamException.timeout(UPSTREAM);
        });
    }

    private String discoveryUrl() {
        return config.discoveryUrl().filter(s -> !s.isBlank()).orElseGet(() -> {
            final var issuer = config.issuer();
            return (issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer) + DISCOVERY_PATH;
        });
    }

    private boolean isBasicAuth() {
        return !"client_secret_post".equalsIgnoreCase(config.clientAuthMethod());
    }

    private long timeoutMillis() {
        return config.timeout().toMillis();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Drops cached discovery metadata.
     */
    void invalidate() {
        cache.invalidateAll();
    }
}
