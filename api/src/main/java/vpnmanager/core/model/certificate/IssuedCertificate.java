package vpnmanager.core.model.certificate;

/**
 * A freshly issued certificate together with key material for the caller.
 *
 * <p>The key material is handed to the requester once and is not retained.
 */
public record IssuedCertificate(Certificate certificate, String certificatePem, String privateKeyPem, String caPem) {

    @Override
    public String toString() {
        return "IssuedCertificate[fingerprint=" + certificate.fingerprint() + "]";
    }
}
