package vpnmanager.adapter.out.oidc;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import vpnmanager.core.cache.CaffeineLocalCache;
import vpnmanager.core.cache.LocalCache;
import vpnmanager.core.config.OidcConfig;
import vpnmanager.core.exception.UpstreamException;

/**
 * Caches the provider's JSON Web Key Set.
 *
 * <p>Concurrent misses for the same URI share a single fetch. A fetch is retried once
 * on failure. An unknown key id forces one refresh to pick up rotated keys.
 */
@ApplicationScoped
public class JwksKeyCache {

    private static final Logger LOG = Logger.getLogger(JwksKeyCache.class);
    private static final String UPSTREAM = "identity provider";

    private final WebClient webClient;
    private final Duration timeout;
    private final LocalCache<String, JsonWebKeySet> cache;
    private final Map<String, Uni<JsonWebKeySet>> inFlightFetches = new ConcurrentHashMap<>();

    @Inject
    public JwksKeyCache(Vertx vertx, OidcConfig config) {
        this.webClient = WebClient.create(vertx);
        this.timeout = config.timeout();
        this.cache = new CaffeineLocalCache<>(config.metadataCacheTtl(), 8);
    }

    /**
     * Finds the key for a {@code kid}, refreshing the set once if it is not known.
     */
    public Uni<Optional<JsonWebKey>> getKey(String jwksUri, String keyId) {
        return getKeySet(jwksUri).flatMap(keySet -> {
            final var key = findKey(keySet, keyId);
            if (key.isPresent()) {
                return Uni.createFrom().item(key);
            }
            LOG.infof("Key %s not in cached JWKS, refreshing %s", keyId, jwksUri);
            cache.invalidate(jwksUri);
            return getKeySet(jwksUri).map(refreshed -> findKey(refreshed, keyId));
        });
    }

    Uni<JsonWebKeySet> getKeySet(String jwksUri) {
        final var cached = cache.get(jwksUri);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, this::createFetch));
    }

    private Uni<JsonWebKeySet> createFetch(String jwksUri) {
        return fetch(jwksUri)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(jwksUri))
                .memoize()
                .indefinitely();
    }

    private Uni<JsonWebKeySet> fetch(String jwksUri) {
        LOG.infof("Fetching JWKS from %s", jwksUri);
        return webClient
                .getAbs(jwksUri)
                .timeout(timeout.toMillis())
                .send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> UpstreamException.timeout(UPSTREAM))
                .map(this::parse)
                .onFailure()
                .retry()
                .atMost(1)
                .invoke(keySet -> cache.put(jwksUri, keySet))
                .onFailure(e -> !(e instanceof UpstreamException))
                .transform(e -> {
                    if (e instanceof TimeoutException) {
                        return UpstreamException.timeout(UPSTREAM);
                    }
                    LOG.errorf(e, "Failed to fetch JWKS from %s", jwksUri);
                    return UpstreamException.rejected(UPSTREAM, "Identity provider signing keys are unavailable");
                });
    }

    private JsonWebKeySet parse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw UpstreamException.rejected(UPSTREAM, "JWKS endpoint returned status " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new UpstreamException(
                    UpstreamException.Reason.PROVIDER_REJECTED, UPSTREAM, "Malformed JWKS document", e);
        }
    }

    private static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        if (keyId == null) {
            final var keys = keySet.getJsonWebKeys();
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
        }
        return keySet.getJsonWebKeys().stream()
                .filter(key -> keyId.equals(key.getKeyId()))
                .findFirst();
    }
}
