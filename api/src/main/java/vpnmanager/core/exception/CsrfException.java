package vpnmanager.core.exception;

/**
 * A state-changing request did not carry a valid CSRF token.
 */
public class CsrfException extends VpnManagerException {

    public enum Reason {
        MISSING_TOKEN,
        TOKEN_MISMATCH
    }

    private final Reason reason;

    public CsrfException(Reason reason) {
        super(reason == Reason.MISSING_TOKEN ? "The CSRF token is missing" : "The CSRF token is invalid");
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
