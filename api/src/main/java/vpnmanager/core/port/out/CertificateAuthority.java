package vpnmanager.core.port.out;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.certificate.IssuanceRequest;
import vpnmanager.core.model.certificate.SignedCertificate;

/**
 * Outbound port for the signing backend.
 *
 * <p>Every call to {@link #sign} is an independent signing operation producing a
 * new key pair and a new certificate.
 */
public interface CertificateAuthority {

    /**
     * Generates a key pair and signs a certificate for it.
     *
     * @param request validated subject information
     * @param validity how long the certificate is valid
     * @return the signed certificate and its private key
     */
    Uni<SignedCertificate> sign(IssuanceRequest request, Duration validity);

    /**
     * PEM encoding of the CA certificate, embedded into profiles and bundles.
     */
    String caCertificatePem();

    /**
     * Distinguished name of the issuing CA.
     */
    String issuerDn();

    /**
     * Whether the CA certificate is within its validity period at {@code now}.
     */
    boolean isUsable(Instant now);
}
