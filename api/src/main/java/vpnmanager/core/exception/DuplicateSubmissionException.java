package vpnmanager.core.exception;

/**
 * An identical issuance request from the same principal is still being processed.
 */
public class DuplicateSubmissionException extends VpnManagerException {

    public DuplicateSubmissionException() {
        super("An identical request is already in progress");
    }
}
