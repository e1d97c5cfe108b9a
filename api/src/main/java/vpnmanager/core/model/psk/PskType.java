package vpnmanager.core.model.psk;

import java.util.Locale;
import java.util.Optional;

import vpnmanager.core.model.certificate.CertificateType;

/**
 * What a pre-shared key may be used to obtain.
 */
public enum PskType {
    SERVER(CertificateType.SERVER),
    COMPUTER(CertificateType.COMPUTER);

    private final CertificateType certificateType;

    PskType(CertificateType certificateType) {
        this.certificateType = certificateType;
    }

    /**
     * The only certificate type a key of this type may mint.
     */
    public CertificateType certificateType() {
        return certificateType;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PskType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (PskType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
