package vpnmanager.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Pending authorization-code exchange, keyed by the OAuth {@code state} value.
 *
 * <p>Created when login is initiated and consumed exactly once by the callback.
 *
 * @param stateId the {@code state} parameter sent to the provider
 * @param nonce value the ID token must echo back
 * @param codeVerifier PKCE verifier sent with the token request
 * @param codeChallenge PKCE challenge sent with the authorization request
 * @param redirectTarget local path to return to after login
 * @param createdAt creation time
 * @param expiresAt time after which the exchange can no longer be consumed
 */
public record OidcExchange(
        String stateId,
        String nonce,
        String codeVerifier,
        String codeChallenge,
        String redirectTarget,
        Instant createdAt,
        Instant expiresAt) {

    public OidcExchange {
        Objects.requireNonNull(stateId, "stateId");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(codeVerifier, "codeVerifier");
        Objects.requireNonNull(codeChallenge, "codeChallenge");
        if (redirectTarget == null || redirectTarget.isBlank()) {
            redirectTarget = "/";
        }
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
