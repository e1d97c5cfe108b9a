package vpnmanager.core.model.certificate;

import java.util.Locale;

/**
 * Reasons recorded when revoking a certificate, a subset of the RFC 5280 CRL reason codes.
 */
public enum RevocationReason {
    UNSPECIFIED,
    KEY_COMPROMISE,
    SUPERSEDED,
    CESSATION_OF_OPERATION,
    AFFILIATION_CHANGED;

    /**
     * Lenient parser for form input. Unknown or missing values map to {@link #UNSPECIFIED}.
     */
    public static RevocationReason fromInput(String value) {
        if (value == null || value.isBlank()) {
            return UNSPECIFIED;
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RevocationReason reason : values()) {
            if (reason.name().equals(normalized)) {
                return reason;
            }
        }
        return UNSPECIFIED;
    }
}
