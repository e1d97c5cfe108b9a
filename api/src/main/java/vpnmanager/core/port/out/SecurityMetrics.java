package vpnmanager.core.port.out;

import vpnmanager.core.model.certificate.CertificateType;

/**
 * Port for recording security-relevant counters.
 */
public interface SecurityMetrics {

    void recordLogin();

    void recordAuthFailure(String reason);

    void recordCsrfRejection(String reason);

    void recordIssuance(CertificateType type);

    void recordRevocation(CertificateType type);

    void recordPskRejection(String reason);

    void recordDuplicateSubmission();
}
