package vpnmanager.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for pre-shared keys.
 *
 * <p>Configuration prefix: {@code vpn.psk}
 */
@ConfigMapping(prefix = "vpn.psk")
public interface PskConfig {

    /**
     * Longest lifetime an admin may give a key. Unset means keys may never expire.
     *
     * @return maximum TTL
     */
    Optional<Duration> maxTtl();

    /**
     * Template set assigned when the creator names none.
     *
     * @return template set name (default: Default)
     */
    @WithDefault("Default")
    String defaultTemplateSet();
}
