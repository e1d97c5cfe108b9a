package vpnmanager.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.Page;
import vpnmanager.core.model.certificate.PageRequest;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.model.certificate.TransparencyLogEntry;
import vpnmanager.core.port.out.CertificateRepository;

/**
 * In-memory certificate store and transparency log.
 *
 * <p>Thread-safety: all writes hold one lock so a certificate change and its log
 * entry become visible together. Reads copy under the same lock.
 */
@ApplicationScoped
public class InMemoryCertificateRepository implements CertificateRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryCertificateRepository.class);

    private final Map<String, Certificate> byFingerprint = new HashMap<>();
    // issuance order, oldest first
    private final List<String> issuanceOrder = new ArrayList<>();
    private final List<TransparencyLogEntry> log = new ArrayList<>();
    private final Object lock = new Object();
    private long sequence;

    @Override
    public Uni<TransparencyLogEntry> recordIssuance(Certificate certificate) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                if (byFingerprint.containsKey(certificate.fingerprint())) {
                    throw new IllegalStateException("Certificate already recorded");
                }
                byFingerprint.put(certificate.fingerprint(), certificate);
                issuanceOrder.add(certificate.fingerprint());
                final var entry = TransparencyLogEntry.issued(certificate, certificate.issuedAt())
                        .withSequence(++sequence);
                log.add(entry);
                LOG.debugf("Recorded issuance #%d", entry.sequence());
                return entry;
            }
        });
    }

    @Override
    public Uni<Boolean> markRevoked(String fingerprint, Instant revokedAt, RevocationReason reason, String actor) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var current = byFingerprint.get(fingerprint);
                if (current == null || current.isRevoked()) {
                    return false;
                }
                final var revoked = current.revoke(revokedAt, reason);
                byFingerprint.put(fingerprint, revoked);
                log.add(TransparencyLogEntry.revoked(revoked, actor, revokedAt).withSequence(++sequence));
                return true;
            }
        });
    }

    @Override
    public Uni<Optional<Certificate>> findByFingerprint(String fingerprint) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                return Optional.ofNullable(byFingerprint.get(fingerprint));
            }
        });
    }

    @Override
    public Uni<Page<Certificate>> query(CertificateFilter filter, PageRequest page) {
        return Uni.createFrom().item(() -> {
            final List<Certificate> matches = new ArrayList<>();
            synchronized (lock) {
                for (int i = issuanceOrder.size() - 1; i >= 0; i--) {
                    final var certificate = byFingerprint.get(issuanceOrder.get(i));
                    if (filter.matches(certificate)) {
                        matches.add(certificate);
                    }
                }
            }
            return Page.slice(matches, page);
        });
    }

    @Override
    public Uni<Page<TransparencyLogEntry>> events(PageRequest page) {
        return Uni.createFrom().item(() -> {
            final List<TransparencyLogEntry> newestFirst;
            synchronized (lock) {
                newestFirst = new ArrayList<>(log);
            }
            Collections.reverse(newestFirst);
            return Page.slice(newestFirst, page);
        });
    }
}
