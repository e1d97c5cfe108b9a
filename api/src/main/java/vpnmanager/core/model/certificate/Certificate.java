package vpnmanager.core.model.certificate;

import java.time.Instant;
import java.util.Objects;

/**
 * An issued X.509 certificate as recorded by the service.
 *
 * <p>Only the revocation fields ever change after issuance.
 *
 * @param fingerprint lowercase hex SHA-256 of the DER encoding
 * @param type certificate kind
 * @param subjectDn subject distinguished name
 * @param issuerDn issuer distinguished name
 * @param commonName CN component of the subject
 * @param ownerSubject identity subject of the owning user, null for PSK-issued certificates
 * @param serialNumber hex serial number assigned by the CA
 * @param notBefore start of validity
 * @param notAfter end of validity
 * @param issuedBy actor that requested issuance (user subject or PSK description)
 * @param issuedAt when the service recorded the issuance; notBefore is backdated for clock skew
 * @param revokedAt revocation time, null while the certificate is valid
 * @param revocationReason reason recorded with the revocation, null while valid
 */
public record Certificate(
        String fingerprint,
        CertificateType type,
        String subjectDn,
        String issuerDn,
        String commonName,
        String ownerSubject,
        String serialNumber,
        Instant notBefore,
        Instant notAfter,
        String issuedBy,
        Instant issuedAt,
        Instant revokedAt,
        RevocationReason revocationReason) {

    public Certificate {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subjectDn, "subjectDn");
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isOwnedBy(String subject) {
        return ownerSubject != null && ownerSubject.equals(subject);
    }

    /**
     * Returns a copy carrying the given revocation fields.
     */
    public Certificate revoke(Instant at, RevocationReason reason) {
        return new Certificate(
                fingerprint,
                type,
                subjectDn,
                issuerDn,
                commonName,
                ownerSubject,
                serialNumber,
                notBefore,
                notAfter,
                issuedBy,
                issuedAt,
                at,
                reason == null ? RevocationReason.UNSPECIFIED : reason);
    }
}
