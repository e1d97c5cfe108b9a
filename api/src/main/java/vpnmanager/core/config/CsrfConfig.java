package vpnmanager.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for CSRF protection.
 *
 * <p>Configuration prefix: {@code vpn.csrf}
 */
@ConfigMapping(prefix = "vpn.csrf")
public interface CsrfConfig {

    /**
     * Form field carrying the token.
     *
     * @return field name (default: csrf_token)
     */
    @WithDefault("csrf_token")
    String fieldName();

    /**
     * Header carrying the token for script clients.
     *
     * @return header name (default: X-CSRFToken)
     */
    @WithDefault("X-CSRFToken")
    String headerName();
}
