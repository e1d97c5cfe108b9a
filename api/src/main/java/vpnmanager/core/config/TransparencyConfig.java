package vpnmanager.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for certificate listing and the transparency log.
 *
 * <p>Configuration prefix: {@code vpn.transparency}
 */
@ConfigMapping(prefix = "vpn.transparency")
public interface TransparencyConfig {

    @WithDefault("20")
    int defaultPageSize();

    @WithDefault("100")
    int maxPageSize();
}
