package vpnmanager.core.exception;

import vpnmanager.core.model.common.ValidationResult;

/**
 * Input was malformed or oversized and was rejected before reaching business logic.
 */
public class ValidationException extends VpnManagerException {

    public enum Reason {
        MALFORMED_INPUT,
        TOO_LONG
    }

    private final Reason reason;
    private final String field;

    public ValidationException(Reason reason, String field, String message) {
        super(message);
        this.reason = reason;
        this.field = field;
    }

    public Reason reason() {
        return reason;
    }

    public String field() {
        return field;
    }

    public static ValidationException malformed(String field, String message) {
        return new ValidationException(Reason.MALFORMED_INPUT, field, message);
    }

    public static ValidationException from(ValidationResult.Invalid invalid) {
        return new ValidationException(
                invalid.tooLong() ? Reason.TOO_LONG : Reason.MALFORMED_INPUT, invalid.field(), invalid.reason());
    }
}
