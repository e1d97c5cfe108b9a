package vpnmanager.core.port.out;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.auth.OidcProviderMetadata;

/**
 * Outbound port that checks an ID token's signature, issuer, audience and lifetime.
 *
 * <p>Nonce comparison is not part of this port; the login flow does it against its own exchange.
 */
public interface IdTokenVerifier {

    Uni<IdTokenClaims> verify(String idToken, OidcProviderMetadata metadata);
}
