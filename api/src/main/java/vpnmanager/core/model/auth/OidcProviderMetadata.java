package vpnmanager.core.model.auth;

import java.util.Optional;

/**
 * Subset of the provider's {@code /.well-known/openid-configuration} document.
 *
 * @param issuer expected {@code iss} claim
 * @param authorizationEndpoint where browsers are sent to log in
 * @param tokenEndpoint where authorization codes are exchanged
 * @param jwksUri location of the provider's signing keys
 * @param endSessionEndpoint RP-initiated logout endpoint, if the provider supports it
 */
public record OidcProviderMetadata(
        String issuer,
        String authorizationEndpoint,
        String tokenEndpoint,
        String jwksUri,
        Optional<String> endSessionEndpoint) {

    public OidcProviderMetadata {
        endSessionEndpoint = endSessionEndpoint == null ? Optional.empty() : endSessionEndpoint;
    }
}
