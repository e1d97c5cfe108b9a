package vpnmanager.adapter.in.http;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for HTTP security response headers.
 *
 * <p>Configuration prefix: {@code vpn.security-headers}
 */
@ConfigMapping(prefix = "vpn.security-headers")
public interface SecurityHeadersConfig {

    /**
     * @return true if security headers should be added (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    @WithDefault("nosniff")
    String contentTypeOptions();

    @WithDefault("DENY")
    String frameOptions();

    /**
     * Scripts may only come from this origin and the pages may not be framed.
     *
     * @return CSP value
     */
    @WithDefault("default-src 'self'; script-src 'self'; object-src 'none'; base-uri 'self'; "
            + "form-action 'self'; frame-ancestors 'none'")
    String contentSecurityPolicy();

    @WithDefault("strict-origin-when-cross-origin")
    String referrerPolicy();

    @WithDefault("1; mode=block")
    String xssProtection();

    /**
     * Cache-Control value for every response except health checks.
     *
     * @return header value (default: no-store)
     */
    @WithDefault("no-store")
    String cacheControl();

    /**
     * Strict-Transport-Security header value.
     *
     * <p>Not set by default. Only enable behind TLS termination.
     *
     * @return optional HSTS value
     */
    Optional<String> strictTransportSecurity();
}
