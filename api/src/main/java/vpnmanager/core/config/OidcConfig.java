package vpnmanager.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the OIDC relying party.
 *
 * <p>Configuration prefix: {@code vpn.auth.oidc}
 */
@ConfigMapping(prefix = "vpn.auth.oidc")
public interface OidcConfig {

    /**
     * Expected issuer of ID tokens. Discovery is performed against
     * {@code {issuer}/.well-known/openid-configuration} unless
     * {@link #discoveryUrl()} overrides it.
     *
     * @return issuer URL
     */
    String issuer();

    /**
     * Explicit discovery document URL.
     *
     * @return discovery URL override
     */
    Optional<String> discoveryUrl();

    /**
     * OAuth client identifier registered with the provider.
     *
     * @return client ID
     */
    String clientId();

    /**
     * Client secret for confidential clients. Public clients rely on PKCE alone.
     *
     * @return client secret
     */
    Optional<String> clientSecret();

    /**
     * How the client authenticates to the token endpoint.
     *
     * <p>One of {@code client_secret_basic} or {@code client_secret_post}.
     *
     * @return method (default: client_secret_basic)
     */
    @WithDefault("client_secret_basic")
    String clientAuthMethod();

    /**
     * Absolute callback URL registered with the provider, ending in {@code /auth/callback}.
     *
     * @return redirect URI
     */
    String redirectUri();

    /**
     * Where the provider returns the browser after logout. Should point at
     * {@code /auth/logout/complete} on this service.
     *
     * @return post logout redirect URI
     */
    Optional<String> postLogoutRedirectUri();

    /**
     * Scopes requested at login.
     *
     * @return space separated scopes (default: openid profile email)
     */
    @WithDefault("openid profile email")
    String scopes();

    /**
     * Upper bound for each call to the provider.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * Lifetime of a pending login exchange.
     *
     * @return exchange TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration exchangeTtl();

    /**
     * How long discovery metadata and signing keys are cached.
     *
     * @return cache TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration metadataCacheTtl();

    /**
     * Allowed clock skew when validating ID token timestamps.
     *
     * @return skew (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Claim holding group memberships.
     *
     * @return claim name (default: groups)
     */
    @WithDefault("groups")
    String groupsClaim();

    /**
     * Groups whose members receive the admin role.
     *
     * @return admin groups (default: admins)
     */
    @WithDefault("admins")
    List<String> adminGroups();
}
