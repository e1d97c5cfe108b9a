package vpnmanager.core.model.common;

/**
 * Outcome of validating a single untrusted input value.
 */
public sealed interface ValidationResult {

    record Valid() implements ValidationResult {}

    record Invalid(String field, String reason, boolean tooLong) implements ValidationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }

    default boolean isInvalid() {
        return this instanceof Invalid;
    }

    static ValidationResult valid() {
        return new Valid();
    }

    static ValidationResult malformed(String field, String reason) {
        return new Invalid(field, reason, false);
    }

    static ValidationResult tooLong(String field, int maxLength) {
        return new Invalid(field, "%s must be at most %d characters".formatted(field, maxLength), true);
    }
}
