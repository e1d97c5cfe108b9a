package vpnmanager.adapter.in.validation;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.CertificateType;

/**
 * Builds a {@link CertificateFilter} from raw query parameters.
 *
 * <p>Absent or blank parameters impose no condition. A present but unparseable
 * type or date is a validation error.
 */
public final class QueryFilters {

    static final int MAX_SUBJECT_LENGTH = 256;

    private QueryFilters() {}

    public static CertificateFilter certificateFilter(
            String type, String subject, String fromDate, String toDate, String includeRevoked) {
        return new CertificateFilter(
                type(type),
                subject(subject),
                date("from_date", fromDate),
                date("to_date", toDate),
                includeRevoked(includeRevoked),
                Optional.empty());
    }

    static Optional<CertificateType> type(String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        return Optional.of(CertificateType.parse(raw)
                .orElseThrow(() -> ValidationException.malformed("type", "Unknown certificate type")));
    }

    static Optional<String> subject(String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        if (raw.length() > MAX_SUBJECT_LENGTH) {
            throw ValidationException.malformed("subject", "Subject filter is too long");
        }
        return Optional.of(raw.trim());
    }

    static Optional<LocalDate> date(String field, String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            throw ValidationException.malformed(field, "Dates must use the YYYY-MM-DD format");
        }
    }

    /**
     * Absent means include everything.
     */
    static boolean includeRevoked(String raw) {
        if (isBlank(raw)) {
            return true;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "false", "0", "no", "off" -> false;
            default -> true;
        };
    }

    private static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }
}
