package vpnmanager.core.exception;

/**
 * Base class for the error taxonomy surfaced by the core.
 *
 * <p>Messages are safe to show to users. They never contain secrets, tokens or
 * whether a resource exists for another owner.
 */
public abstract class VpnManagerException extends RuntimeException {

    protected VpnManagerException(String message) {
        super(message);
    }

    protected VpnManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
