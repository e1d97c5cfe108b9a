package vpnmanager.adapter.in.health;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import vpnmanager.core.port.out.CertificateAuthority;

/**
 * Readiness check for the local certificate authority.
 *
 * <p>DOWN while the CA certificate is outside its validity period, since every
 * certificate signed then would be rejected by VPN peers.
 */
@Readiness
@ApplicationScoped
public class CertificateAuthorityHealthCheck implements HealthCheck {

    private final CertificateAuthority authority;

    @Inject
    public CertificateAuthorityHealthCheck(CertificateAuthority authority) {
        this.authority = authority;
    }

    @Override
    public HealthCheckResponse call() {
        final var builder = HealthCheckResponse.named("certificate-authority")
                .withData("issuer", authority.issuerDn());
        return authority.isUsable(Instant.now()) ? builder.up().build() : builder.down().build();
    }
}
