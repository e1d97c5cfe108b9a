package vpnmanager.core.port.in;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.IssuanceAuthorization;
import vpnmanager.core.model.certificate.IssuanceRequest;
import vpnmanager.core.model.certificate.IssuedCertificate;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.model.session.Session;

/**
 * Inbound port for certificate issuance, lookup and revocation.
 */
public interface CertificateManagement {

    /**
     * Signs and records a new certificate.
     *
     * @param request subject information
     * @param authorization exactly one of a session (client certificates) or a PSK (server/computer)
     * @return the recorded certificate with its key material
     */
    Uni<IssuedCertificate> issue(IssuanceRequest request, IssuanceAuthorization authorization);

    /**
     * Looks up a certificate the session may read.
     *
     * <p>Malformed fingerprints, unknown fingerprints and certificates of other owners
     * all fail with the same not-found error.
     */
    Uni<Certificate> get(String fingerprint, Session session);

    /**
     * Revokes a certificate. Revoking an already revoked certificate succeeds without change.
     *
     * @return the certificate in its revoked state
     */
    Uni<Certificate> revoke(String fingerprint, RevocationReason reason, Session session);
}
