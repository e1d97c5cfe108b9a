package vpnmanager.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for browser sessions.
 *
 * <p>Configuration prefix: {@code vpn.session}
 */
@ConfigMapping(prefix = "vpn.session")
public interface SessionConfig {

    /**
     * Cookie configuration.
     */
    CookieConfig cookie();

    /**
     * Absolute session lifetime.
     *
     * @return Session duration (default: 8 hours)
     */
    @WithDefault("PT8H")
    Duration ttl();

    /**
     * Idle timeout - invalidate session after inactivity.
     *
     * @return Idle duration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration idleTimeout();

    /**
     * Refresh the last access time on each request so the idle timeout slides.
     *
     * @return true if sliding expiration is enabled (default: true)
     */
    @WithDefault("true")
    boolean slidingExpiration();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Cookie configuration options.
     */
    interface CookieConfig {

        /**
         * @return Cookie name (default: vpn_session)
         */
        @WithDefault("vpn_session")
        String name();

        /**
         * @return Cookie path (default: /)
         */
        @WithDefault("/")
        String path();

        /**
         * @return Cookie domain (optional)
         */
        Optional<String> domain();

        /**
         * @return true to send only over HTTPS (default: true)
         */
        @WithDefault("true")
        boolean secure();

        /**
         * SameSite attribute, {@code Lax} or {@code Strict}.
         *
         * @return SameSite value (default: Lax)
         */
        @WithDefault("Lax")
        String sameSite();
    }

    /**
     * Session ID generation options.
     */
    interface IdGenerationConfig {

        /**
         * Maximum attempts to generate a unique session ID.
         *
         * @return Max retry attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }
}
