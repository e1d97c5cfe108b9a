package vpnmanager.core.exception;

/**
 * A presented pre-shared key was rejected.
 *
 * <p>The message is identical for every reason. The reason is for logs and metrics only.
 */
public class PskException extends VpnManagerException {

    public enum Reason {
        INVALID,
        EXPIRED,
        WRONG_TYPE
    }

    private final Reason reason;

    public PskException(Reason reason) {
        super("Invalid pre-shared key");
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
