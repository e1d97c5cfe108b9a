package vpnmanager.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.Page;
import vpnmanager.core.model.certificate.PageRequest;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.model.certificate.TransparencyLogEntry;

/**
 * Outbound port for certificates and the transparency log.
 *
 * <p>The certificate table and the log are written together: an issuance writes
 * one certificate and one ISSUED entry, a revocation updates one certificate and
 * writes one REVOKED entry. Neither write is ever visible without the other.
 */
public interface CertificateRepository {

    /**
     * Persists a new certificate together with its ISSUED log entry.
     *
     * @param certificate the certificate to record
     * @return the log entry with its assigned sequence number
     * @throws IllegalStateException if the fingerprint is already recorded
     */
    Uni<TransparencyLogEntry> recordIssuance(Certificate certificate);

    /**
     * Sets the revocation fields if, and only if, they are not yet set.
     *
     * @param fingerprint certificate to revoke
     * @param revokedAt revocation time
     * @param reason revocation reason
     * @param actor who revoked it, recorded in the log
     * @return true if this call revoked the certificate, false if it was already revoked or is unknown
     */
    Uni<Boolean> markRevoked(String fingerprint, Instant revokedAt, RevocationReason reason, String actor);

    Uni<Optional<Certificate>> findByFingerprint(String fingerprint);

    /**
     * Returns certificates matching the filter, newest first.
     */
    Uni<Page<Certificate>> query(CertificateFilter filter, PageRequest page);

    /**
     * Returns transparency log entries, newest first.
     */
    Uni<Page<TransparencyLogEntry>> events(PageRequest page);
}
