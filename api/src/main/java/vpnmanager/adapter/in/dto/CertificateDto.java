package vpnmanager.adapter.in.dto;

import java.time.Instant;

import vpnmanager.core.model.certificate.Certificate;

/**
 * DTO for certificate responses. Owner identity is not exposed.
 *
 * @param fingerprint SHA-256 fingerprint, lowercase hex
 * @param type client, server or computer
 * @param subjectDn subject distinguished name
 * @param issuerDn issuer distinguished name
 * @param commonName subject common name
 * @param serialNumber hex serial
 * @param notBefore start of validity
 * @param notAfter end of validity
 * @param issuedBy principal that requested the certificate
 * @param issuedAt when the certificate was issued
 * @param revoked whether the certificate is revoked
 * @param revokedAt revocation time, null if active
 * @param revocationReason revocation reason, null if active
 */
public record CertificateDto(
        String fingerprint,
        String type,
        String subjectDn,
        String issuerDn,
        String commonName,
        String serialNumber,
        Instant notBefore,
        Instant notAfter,
        String issuedBy,
        Instant issuedAt,
        boolean revoked,
        Instant revokedAt,
        String revocationReason) {

    public static CertificateDto fromModel(Certificate model) {
        return new CertificateDto(
                model.fingerprint(),
                model.type().wireName(),
                model.subjectDn(),
                model.issuerDn(),
                model.commonName(),
                model.serialNumber(),
                model.notBefore(),
                model.notAfter(),
                model.issuedBy(),
                model.issuedAt(),
                model.isRevoked(),
                model.revokedAt(),
                model.revocationReason() == null ? null : model.revocationReason().name());
    }
}
