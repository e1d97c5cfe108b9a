package vpnmanager.core.model.auth;

/**
 * Tokens returned by the provider's token endpoint.
 *
 * <p>Only the ID token is used; the access token is kept for completeness and never stored.
 */
public record OidcTokenResponse(String idToken, String accessToken, String tokenType, long expiresIn) {

    @Override
    public String toString() {
        return "OidcTokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
    }
}
