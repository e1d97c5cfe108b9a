package vpnmanager.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for certificate issuance.
 *
 * <p>Configuration prefix: {@code vpn.pki}
 */
@ConfigMapping(prefix = "vpn.pki")
public interface CertificateConfig {

    /**
     * Organization placed in issued subjects.
     *
     * @return organization (default: VPN Manager)
     */
    @WithDefault("VPN Manager")
    String organization();

    /**
     * Upper bound for one signing call.
     *
     * @return timeout (default: 15 seconds)
     */
    @WithDefault("PT15S")
    Duration signingTimeout();

    /**
     * Validity periods per certificate type.
     */
    ValidityConfig validity();

    /**
     * Local certificate authority settings.
     */
    AuthorityConfig authority();

    /**
     * Duplicate submission guard.
     */
    DuplicateGuardConfig duplicateGuard();

    interface ValidityConfig {

        @WithDefault("P365D")
        Duration client();

        @WithDefault("P825D")
        Duration server();

        @WithDefault("P365D")
        Duration computer();
    }

    interface AuthorityConfig {

        /**
         * Common name of the generated CA when no key material is configured.
         *
         * @return CA common name (default: VPN Manager CA)
         */
        @WithDefault("VPN Manager CA")
        String commonName();

        /**
         * PEM file holding the CA certificate.
         *
         * @return path to the CA certificate
         */
        Optional<String> certificatePath();

        /**
         * PEM file holding the CA private key.
         *
         * @return path to the CA key
         */
        Optional<String> privateKeyPath();
    }

    interface DuplicateGuardConfig {

        /**
         * Reject a second identical issuance request while the first is in flight.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
