package vpnmanager.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import vpnmanager.core.model.routing.ServiceMode;

/**
 * Configuration mapping for this instance's identity and service separation.
 *
 * <p>Configuration prefix: {@code vpn.service}
 *
 * <p>In a split deployment one instance runs {@code user-only} and another
 * {@code admin-only}. Each knows the base URL of the other so misrouted
 * browser requests can be redirected.
 */
@ConfigMapping(prefix = "vpn.service")
public interface ServiceConfig {

    /**
     * Name reported by the health endpoint.
     *
     * @return service name (default: frontend)
     */
    @WithDefault("frontend")
    String name();

    /**
     * Deployment mode: {@code combined}, {@code user-only} or {@code admin-only}.
     *
     * @return mode (default: combined)
     */
    @WithDefault("combined")
    ServiceMode mode();

    /**
     * Base URL of the user-facing instance, used by admin-only instances.
     *
     * @return user service URL
     */
    Optional<String> userServiceUrl();

    /**
     * Base URL of the admin instance, used by user-only instances.
     *
     * @return admin service URL
     */
    Optional<String> adminServiceUrl();
}
