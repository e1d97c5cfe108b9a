package vpnmanager.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.port.out.SecurityMetrics;

/**
 * Micrometer counters for security relevant events.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code vpn.auth.logins} - Completed logins</li>
 *   <li>{@code vpn.auth.failures} - Failed login callbacks by reason</li>
 *   <li>{@code vpn.csrf.rejections} - Rejected mutations by reason</li>
 *   <li>{@code vpn.certificates.issued} - Issued certificates by type</li>
 *   <li>{@code vpn.certificates.revoked} - Revoked certificates by type</li>
 *   <li>{@code vpn.psk.rejections} - Rejected machine credentials by reason</li>
 *   <li>{@code vpn.certificates.duplicates} - Rejected duplicate submissions</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSecurityMetrics implements SecurityMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerSecurityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordLogin() {
        Counter.builder("vpn.auth.logins")
                .description("Completed OIDC logins")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthFailure(String reason) {
        Counter.builder("vpn.auth.failures")
                .description("Rejected OIDC callbacks")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCsrfRejection(String reason) {
        Counter.builder("vpn.csrf.rejections")
                .description("Mutations rejected by CSRF verification")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordIssuance(CertificateType type) {
        Counter.builder("vpn.certificates.issued")
                .description("Certificates issued")
                .tag("type", type.wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocation(CertificateType type) {
        Counter.builder("vpn.certificates.revoked")
                .description("Certificates revoked")
                .tag("type", type.wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordPskRejection(String reason) {
        Counter.builder("vpn.psk.rejections")
                .description("Machine requests rejected for an invalid pre-shared key")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordDuplicateSubmission() {
        Counter.builder("vpn.certificates.duplicates")
                .description("Issuance requests rejected while an identical request was in flight")
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value == null ? "unknown" : value.toLowerCase(Locale.ROOT);
    }
}
