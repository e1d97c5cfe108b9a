package vpnmanager.core.port.in;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.auth.AuthorizationRedirect;
import vpnmanager.core.model.auth.LoginResult;
import vpnmanager.core.model.auth.LogoutPlan;

/**
 * Inbound port for the OIDC relying-party login and logout flow.
 */
public interface AuthenticationFlow {

    /**
     * Starts a login: creates an exchange and returns the provider URL to visit.
     *
     * @param returnTo local path to land on after login; unsafe values fall back to {@code /}
     * @return redirect to the authorization endpoint
     */
    Uni<AuthorizationRedirect> beginLogin(String returnTo);

    /**
     * Completes a login from the provider callback.
     *
     * @param code authorization code
     * @param state state value returned by the provider
     * @return the new session and where to send the browser
     */
    Uni<LoginResult> completeLogin(String code, String state);

    /**
     * Handles an error callback. The matching exchange is consumed and never usable again.
     *
     * @param state state value returned by the provider, may be null
     * @param error provider error code
     * @return always fails with an upstream or authentication error
     */
    Uni<LoginResult> rejectLogin(String state, String error);

    /**
     * First logout stage. Flags the session so it no longer authenticates.
     *
     * @param sessionId current session id, may be null
     * @return where to send the browser next
     */
    Uni<LogoutPlan> beginLogout(String sessionId);

    /**
     * Second logout stage. Destroys the local session.
     *
     * <p>If provider logout was never started for the session, starts it instead.
     */
    Uni<LogoutPlan> completeLogout(String sessionId);
}
