package vpnmanager.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import vpnmanager.core.config.CsrfConfig;
import vpnmanager.core.exception.LoginRequiredException;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.SessionManagement;
import vpnmanager.core.service.auth.AccessControlService;
import vpnmanager.core.service.auth.CsrfTokenService;
import vpnmanager.core.service.auth.RedirectTargets;

/**
 * Resolves the caller's session and applies CSRF and role checks before a resource
 * method runs any business logic.
 */
@ApplicationScoped
public class RequestGuard {

    private final SessionManagement sessions;
    private final SessionCookieManager cookies;
    private final CsrfTokenService csrf;
    private final AccessControlService accessControl;
    private final CsrfConfig csrfConfig;

    @Inject
    public RequestGuard(
            SessionManagement sessions,
            SessionCookieManager cookies,
            CsrfTokenService csrf,
            AccessControlService accessControl,
            CsrfConfig csrfConfig) {
        this.sessions = sessions;
        this.cookies = cookies;
        this.csrf = csrf;
        this.accessControl = accessControl;
        this.csrfConfig = csrfConfig;
    }

    /**
     * Requires a valid session.
     *
     * @throws LoginRequiredException (as failure) if the request carries no valid session
     */
    public Uni<Session> requireSession(HttpServerRequest request) {
        final var sessionId = cookies.extractSessionId(request);
        if (sessionId.isEmpty()) {
            return Uni.createFrom().failure(loginRequired(request));
        }
        return sessions.resolve(sessionId.get()).map(session -> session.orElseThrow(() -> loginRequired(request)));
    }

    /**
     * Requires a valid session and the right to perform an action.
     */
    public Uni<Session> requireSession(HttpServerRequest request, Action action) {
        return requireSession(request).invoke(session -> accessControl.require(session, action));
    }

    /**
     * Requires a valid session and a matching CSRF token for a state-changing request.
     *
     * @param formToken token from the submitted form, null if the client sent it as a header
     */
    public Uni<Session> requireMutation(HttpServerRequest request, String formToken) {
        return requireSession(request).invoke(session -> csrf.verify(session, presentedToken(request, formToken)));
    }

    /**
     * Requires a valid session, a matching CSRF token and the right to perform an action.
     */
    public Uni<Session> requireMutation(HttpServerRequest request, String formToken, Action action) {
        return requireMutation(request, formToken).invoke(session -> accessControl.require(session, action));
    }

    private String presentedToken(HttpServerRequest request, String formToken) {
        if (formToken != null && !formToken.isBlank()) {
            return formToken;
        }
        return request.getHeader(csrfConfig.headerName());
    }

    private static LoginRequiredException loginRequired(HttpServerRequest request) {
        final var uri = request.uri();
        return new LoginRequiredException(RedirectTargets.sanitize(uri));
    }
}
