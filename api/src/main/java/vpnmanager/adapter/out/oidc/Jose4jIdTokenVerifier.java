package vpnmanager.adapter.out.oidc;

import java.util.Collection;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import vpnmanager.core.config.OidcConfig;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.auth.OidcProviderMetadata;
import vpnmanager.core.port.out.IdTokenVerifier;

/**
 * Verifies ID tokens with jose4j against the provider's JWKS.
 *
 * <p>Checks signature, issuer, audience (the client id), expiry and subject.
 */
@ApplicationScoped
public class Jose4jIdTokenVerifier implements IdTokenVerifier {

    private static final Logger LOG = Logger.getLogger(Jose4jIdTokenVerifier.class);
    private static final String UPSTREAM = "identity provider";

    private final JwksKeyCache keys;
    private final OidcConfig config;

    @Inject
    public Jose4jIdTokenVerifier(JwksKeyCache keys, OidcConfig config) {
        this.keys = keys;
        this.config = config;
    }

    @Override
    public Uni<IdTokenClaims> verify(String idToken, OidcProviderMetadata metadata) {
        final String keyId;
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(idToken);
            keyId = jws.getKeyIdHeaderValue();
        } catch (JoseException e) {
            return Uni.createFrom().failure(invalid("ID token is not a valid JWS"));
        }

        return keys.getKey(metadata.jwksUri(), keyId).map(keyOpt -> {
            if (keyOpt.isEmpty()) {
                throw invalid("ID token signing key is unknown");
            }
            return validate(idToken, metadata, keyOpt.get());
        });
    }

    private IdTokenClaims validate(String idToken, OidcProviderMetadata metadata, JsonWebKey key) {
        try {
            final var consumer = new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireExpirationTime()
                    .setAllowedClockSkewInSeconds((int) config.clockSkew().toSeconds())
                    .setExpectedIssuer(metadata.issuer())
                    .setExpectedAudience(config.clientId())
                    .setVerificationKey(key.getKey())
                    .build();
            return toClaims(consumer.processToClaims(idToken));
        } catch (InvalidJwtException e) {
            LOG.warnf("ID token rejected: %s", summarize(e));
            throw invalid("ID token could not be verified");
        } catch (MalformedClaimException e) {
            throw invalid("ID token claims are malformed");
        }
    }

    private IdTokenClaims toClaims(JwtClaims claims) throws MalformedClaimException {
        final var displayName = firstNonBlank(
                claims.getClaimValueAsString("name"),
                claims.getClaimValueAsString("preferred_username"),
                claims.getSubject());
        return new IdTokenClaims(
                claims.getSubject(),
                claims.getClaimValueAsString("nonce"),
                displayName,
                claims.getClaimValueAsString("email"),
                groups(claims.getClaimValue(config.groupsClaim())));
    }

    private static List<String> groups(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().filter(g -> g != null).map(Object::toString).toList();
        }
        if (value instanceof String s && !s.isBlank()) {
            return List.of(s.trim().split("[\\s,]+"));
        }
        return List.of();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private static String summarize(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "expired";
        }
        final var message = String.valueOf(e.getMessage());
        if (message.contains("issuer")) {
            return "issuer";
        }
        if (message.contains("audience")) {
            return "audience";
        }
        if (message.contains("signature")) {
            return "signature";
        }
        return "invalid";
    }

    private static UpstreamException invalid(String message) {
        return UpstreamException.rejected(UPSTREAM, message);
    }
}
