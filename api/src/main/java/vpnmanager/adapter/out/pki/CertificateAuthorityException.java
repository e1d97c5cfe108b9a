package vpnmanager.adapter.out.pki;

/**
 * The local certificate authority could not load its key material or sign.
 */
public class CertificateAuthorityException extends RuntimeException {

    public CertificateAuthorityException(String message, Throwable cause) {
        super(message, cause);
    }
}
