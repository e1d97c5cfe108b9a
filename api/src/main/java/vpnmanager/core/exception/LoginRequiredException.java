package vpnmanager.core.exception;

/**
 * No valid session accompanies a request to a session-protected route.
 *
 * <p>Browser navigations are redirected into the login flow; other requests get a 401.
 */
public class LoginRequiredException extends VpnManagerException {

    private final String returnTo;

    public LoginRequiredException(String returnTo) {
        super("Authentication required");
        this.returnTo = returnTo;
    }

    /**
     * Local path the user wanted, replayed after login.
     */
    public String returnTo() {
        return returnTo;
    }
}
