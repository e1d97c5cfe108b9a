package vpnmanager.core.model.certificate;

import java.time.Instant;

/**
 * One append-only row in the certificate transparency log.
 *
 * @param sequence monotonically increasing position in the log, assigned by the store
 * @param fingerprint certificate the event concerns
 * @param event what happened
 * @param certificateType type of the certificate
 * @param subjectDn subject of the certificate
 * @param actor who caused the event
 * @param occurredAt when it happened
 */
public record TransparencyLogEntry(
        long sequence,
        String fingerprint,
        TransparencyEvent event,
        CertificateType certificateType,
        String subjectDn,
        String actor,
        Instant occurredAt) {

    public static TransparencyLogEntry issued(Certificate certificate, Instant at) {
        return new TransparencyLogEntry(
                0L,
                certificate.fingerprint(),
                TransparencyEvent.ISSUED,
                certificate.type(),
                certificate.subjectDn(),
                certificate.issuedBy(),
                at);
    }

    public static TransparencyLogEntry revoked(Certificate certificate, String actor, Instant at) {
        return new TransparencyLogEntry(
                0L,
                certificate.fingerprint(),
                TransparencyEvent.REVOKED,
                certificate.type(),
                certificate.subjectDn(),
                actor,
                at);
    }

    public TransparencyLogEntry withSequence(long sequence) {
        return new TransparencyLogEntry(sequence, fingerprint, event, certificateType, subjectDn, actor, occurredAt);
    }
}
