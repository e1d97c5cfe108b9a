package vpnmanager.core.model.certificate;

/**
 * Kinds of entry in the certificate transparency log.
 */
public enum TransparencyEvent {
    ISSUED,
    REVOKED
}
