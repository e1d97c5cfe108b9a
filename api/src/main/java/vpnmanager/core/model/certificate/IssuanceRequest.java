package vpnmanager.core.model.certificate;

import java.util.Objects;

/**
 * Validated input for a certificate signing operation.
 *
 * @param type certificate kind
 * @param commonName CN to place in the subject
 * @param email optional email address for client certificates
 */
public record IssuanceRequest(CertificateType type, String commonName, String email) {

    public IssuanceRequest {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(commonName, "commonName");
    }
}
