package vpnmanager.core.port.out;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.auth.OidcProviderMetadata;
import vpnmanager.core.model.auth.OidcTokenResponse;

/**
 * Outbound port for talking to the OIDC provider.
 */
public interface OidcProviderClient {

    /**
     * Returns the provider's discovery metadata. Implementations may cache it.
     */
    Uni<OidcProviderMetadata> metadata();

    /**
     * Exchanges an authorization code for tokens. Never retried.
     *
     * @param metadata provider metadata
     * @param code authorization code from the callback
     * @param codeVerifier PKCE verifier generated for the exchange
     * @return the token response
     */
    Uni<OidcTokenResponse> exchangeCode(OidcProviderMetadata metadata, String code, String codeVerifier);
}
