package vpnmanager.core.exception;

/**
 * The OIDC login flow or session validation failed.
 */
public class AuthenticationException extends VpnManagerException {

    public enum Reason {
        /** The callback's state is unknown, expired or already consumed. */
        INVALID_STATE,
        /** The ID token's nonce does not match the one generated for the exchange. */
        NONCE_MISMATCH,
        /** The session is gone, expired, idle or logging out. */
        SESSION_EXPIRED
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static AuthenticationException invalidState() {
        return new AuthenticationException(Reason.INVALID_STATE, "Login request is invalid or has expired");
    }

    public static AuthenticationException nonceMismatch() {
        return new AuthenticationException(Reason.NONCE_MISMATCH, "Identity token could not be verified");
    }

    public static AuthenticationException sessionExpired() {
        return new AuthenticationException(Reason.SESSION_EXPIRED, "Session expired");
    }
}
