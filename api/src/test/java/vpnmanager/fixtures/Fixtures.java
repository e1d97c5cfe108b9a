package vpnmanager.fixtures;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import vpnmanager.core.model.auth.Role;
import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.util.SecureHash;

/**
 * Builders for model objects shared across tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Session user(String subject) {
        return session(subject, Set.of("staff"), Set.of(Role.USER));
    }

    public static Session admin(String subject) {
        return session(subject, Set.of("admins"), Set.of(Role.USER, Role.ADMIN));
    }

    public static Session session(String subject, Set<String> groups, Set<Role> roles) {
        final var now = Instant.now();
        return new Session(
                "session-" + subject,
                subject,
                subject,
                subject + "@example.com",
                groups,
                roles,
                now,
                now.plus(Duration.ofHours(8)),
                now,
                "csrf-secret-" + subject,
                "id-token-" + subject,
                false);
    }

    public static String fingerprint(String seed) {
        return SecureHash.sha256Hex(seed);
    }

    public static Certificate certificate(String seed, CertificateType type, String owner, Instant notBefore) {
        return new Certificate(
                fingerprint(seed),
                type,
                "CN=" + seed + ",O=VPN Manager",
                "CN=VPN Manager CA",
                seed,
                owner,
                Long.toHexString(seed.hashCode() & 0xffffffffL),
                notBefore,
                notBefore.plus(Duration.ofDays(365)),
                owner == null ? "psk:machine" : "user:" + owner,
                notBefore,
                null,
                null);
    }

    public static Certificate certificate(String seed, String owner) {
        return certificate(seed, CertificateType.CLIENT, owner, Instant.now());
    }
}
