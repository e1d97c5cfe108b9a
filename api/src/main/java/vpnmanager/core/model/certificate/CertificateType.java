package vpnmanager.core.model.certificate;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of certificate the CA issues.
 */
public enum CertificateType {
    /** End-user certificate, issued from a browser session and owned by the user. */
    CLIENT,
    /** OpenVPN server certificate, issued with a server PSK. */
    SERVER,
    /** Machine certificate for unattended computers, issued with a computer PSK. */
    COMPUTER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a type name case-insensitively.
     *
     * @return the type, or empty for null, blank or unknown input
     */
    public static Optional<CertificateType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (CertificateType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
