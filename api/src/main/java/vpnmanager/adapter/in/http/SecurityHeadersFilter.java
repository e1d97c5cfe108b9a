package vpnmanager.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

/**
 * Adds security response headers at the Vert.x routing level, so error pages and
 * redirects produced before JAX-RS carry them too.
 */
@ApplicationScoped
public class SecurityHeadersFilter {

    private static final Logger LOG = Logger.getLogger(SecurityHeadersFilter.class);

    private final Instance<SecurityHeadersConfig> configInstance;

    @Inject
    public SecurityHeadersFilter(Instance<SecurityHeadersConfig> configInstance) {
        this.configInstance = configInstance;
    }

    @RouteFilter(90)
    void addSecurityHeaders(RoutingContext rc) {
        if (!configInstance.isResolvable()) {
            LOG.debug("Security headers config not resolvable, skipping");
            rc.next();
            return;
        }

        final var config = configInstance.get();
        if (!config.enabled()) {
            rc.next();
            return;
        }

        final var response = rc.response();

        response.putHeader("X-Content-Type-Options", config.contentTypeOptions());
        response.putHeader("X-Frame-Options", config.frameOptions());
        response.putHeader("Content-Security-Policy", config.contentSecurityPolicy());
        response.putHeader("Referrer-Policy", config.referrerPolicy());
        response.putHeader("X-XSS-Protection", config.xssProtection());
        if (!isCacheable(rc.normalizedPath())) {
            response.putHeader("Cache-Control", config.cacheControl());
        }

        config.strictTransportSecurity().ifPresent(v -> response.putHeader("Strict-Transport-Security", v));

        rc.next();
    }

    static boolean isCacheable(String path) {
        return path != null && (path.equals("/health") || path.startsWith("/q/"));
    }
}
