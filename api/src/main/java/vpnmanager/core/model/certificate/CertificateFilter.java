package vpnmanager.core.model.certificate;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;

/**
 * Conjunctive filter over certificates. Absent fields impose no constraint.
 *
 * @param type restrict to one certificate type
 * @param subjectContains case-insensitive substring of the subject DN
 * @param fromDate earliest issuance day (inclusive, UTC)
 * @param toDate latest issuance day (inclusive, UTC)
 * @param includeRevoked when false, revoked certificates are excluded
 * @param ownerSubject restrict to certificates owned by this subject
 */
public record CertificateFilter(
        Optional<CertificateType> type,
        Optional<String> subjectContains,
        Optional<LocalDate> fromDate,
        Optional<LocalDate> toDate,
        boolean includeRevoked,
        Optional<String> ownerSubject) {

    public CertificateFilter {
        type = type == null ? Optional.empty() : type;
        subjectContains = subjectContains == null
                ? Optional.empty()
                : subjectContains.map(String::trim).filter(s -> !s.isEmpty());
        fromDate = fromDate == null ? Optional.empty() : fromDate;
        toDate = toDate == null ? Optional.empty() : toDate;
        ownerSubject = ownerSubject == null ? Optional.empty() : ownerSubject;
    }

    public static CertificateFilter none() {
        return new CertificateFilter(
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), true, Optional.empty());
    }

    public static CertificateFilter ownedBy(String subject) {
        return none().withOwner(subject);
    }

    public CertificateFilter withOwner(String subject) {
        return new CertificateFilter(
                type, subjectContains, fromDate, toDate, includeRevoked, Optional.ofNullable(subject));
    }

    /**
     * Evaluates the filter against a certificate.
     */
    public boolean matches(Certificate certificate) {
        if (type.isPresent() && certificate.type() != type.get()) {
            return false;
        }
        if (!includeRevoked && certificate.isRevoked()) {
            return false;
        }
        if (ownerSubject.isPresent() && !certificate.isOwnedBy(ownerSubject.get())) {
            return false;
        }
        if (subjectContains.isPresent()) {
            final var needle = subjectContains.get().toLowerCase(Locale.ROOT);
            if (!certificate.subjectDn().toLowerCase(Locale.ROOT).contains(needle)) {
                return false;
            }
        }
        if (fromDate.isPresent() || toDate.isPresent()) {
            if (certificate.issuedAt() == null) {
                return false;
            }
            final var issuedOn = LocalDate.ofInstant(certificate.issuedAt(), ZoneOffset.UTC);
            if (fromDate.isPresent() && issuedOn.isBefore(fromDate.get())) {
                return false;
            }
            if (toDate.isPresent() && issuedOn.isAfter(toDate.get())) {
                return false;
            }
        }
        return true;
    }
}
