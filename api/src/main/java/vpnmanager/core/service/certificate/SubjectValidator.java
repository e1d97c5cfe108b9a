package vpnmanager.core.service.certificate;

import java.util.regex.Pattern;

import vpnmanager.core.model.common.ValidationResult;

/**
 * Validates values that end up inside a certificate subject.
 */
public final class SubjectValidator {

    public static final int MAX_COMMON_NAME_LENGTH = 64;
    public static final int MAX_EMAIL_LENGTH = 254;

    private static final Pattern COMMON_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9 ._@-]*$");
    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+$");

    private SubjectValidator() {}

    public static ValidationResult validateCommonName(String commonName) {
        if (commonName == null || commonName.isBlank()) {
            return ValidationResult.malformed("commonName", "Common name is required");
        }
        if (commonName.length() > MAX_COMMON_NAME_LENGTH) {
            return ValidationResult.tooLong("commonName", MAX_COMMON_NAME_LENGTH);
        }
        if (!COMMON_NAME.matcher(commonName).matches()) {
            return ValidationResult.malformed("commonName", "Common name contains unsupported characters");
        }
        return ValidationResult.valid();
    }

    /**
     * Email is optional; null or blank is valid.
     */
    public static ValidationResult validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return ValidationResult.valid();
        }
        if (email.length() > MAX_EMAIL_LENGTH) {
            return ValidationResult.tooLong("email", MAX_EMAIL_LENGTH);
        }
        if (!EMAIL.matcher(email).matches()) {
            return ValidationResult.malformed("email", "Email address is malformed");
        }
        return ValidationResult.valid();
    }
}
