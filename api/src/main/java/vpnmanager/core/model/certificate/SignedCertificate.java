package vpnmanager.core.model.certificate;

import java.time.Instant;

/**
 * Output of the certificate authority for one signing operation.
 *
 * @param der DER encoding of the certificate
 * @param certificatePem PEM encoding of the certificate
 * @param privateKeyPem PEM encoding of the generated private key; never persisted
 * @param subjectDn subject distinguished name
 * @param issuerDn issuer distinguished name
 * @param serialNumber hex serial
 * @param notBefore start of validity
 * @param notAfter end of validity
 */
public record SignedCertificate(
        byte[] der,
        String certificatePem,
        String privateKeyPem,
        String subjectDn,
        String issuerDn,
        String serialNumber,
        Instant notBefore,
        Instant notAfter) {

    @Override
    public String toString() {
        return "SignedCertificate[subjectDn=" + subjectDn + ", serialNumber=" + serialNumber + "]";
    }
}
