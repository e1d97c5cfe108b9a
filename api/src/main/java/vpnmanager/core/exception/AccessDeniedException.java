package vpnmanager.core.exception;

import vpnmanager.core.model.auth.DenyReason;

/**
 * An authorization decision denied the requested action.
 */
public class AccessDeniedException extends VpnManagerException {

    private final DenyReason reason;

    public AccessDeniedException(DenyReason reason) {
        super("Access denied");
        this.reason = reason;
    }

    public DenyReason reason() {
        return reason;
    }
}
