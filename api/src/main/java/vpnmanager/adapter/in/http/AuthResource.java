package vpnmanager.adapter.in.http;

import java.net.URI;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import vpnmanager.adapter.in.auth.RequestGuard;
import vpnmanager.adapter.in.auth.SessionCookieManager;
import vpnmanager.adapter.in.dto.SessionInfoDto;
import vpnmanager.core.model.auth.LogoutPlan;
import vpnmanager.core.port.in.AuthenticationFlow;
import vpnmanager.core.service.auth.CsrfTokenService;

/**
 * Browser login and logout endpoints.
 *
 * <p>Login is the OIDC authorization code flow. Logout has two stages: {@code /auth/logout}
 * sends the browser to the provider's end-session endpoint, and the provider returns it to
 * {@code /auth/logout/complete}, which removes the local session.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);
    private static final URI HOME = URI.create("/");

    private final AuthenticationFlow flow;
    private final SessionCookieManager cookies;
    private final RequestGuard guard;
    private final CsrfTokenService csrf;

    @Inject
    public AuthResource(
            AuthenticationFlow flow, SessionCookieManager cookies, RequestGuard guard, CsrfTokenService csrf) {
        this.flow = flow;
        this.cookies = cookies;
        this.guard = guard;
        this.csrf = csrf;
    }

    /**
     * Redirects to the identity provider.
     *
     * @param next local path to return to after login
     */
    @GET
    @Path("/login")
    public Uni<Response> login(@QueryParam("next") String next) {
        return flow.beginLogin(next)
                .map(redirect -> Response.status(Response.Status.FOUND)
                        .location(redirect.location())
                        .build());
    }

    /**
     * Provider callback. Sets the session cookie and returns to the original target.
     */
    @GET
    @Path("/callback")
    public Uni<Response> callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error) {
        final var result = error != null && !error.isBlank()
                ? flow.rejectLogin(state, error)
                : flow.completeLogin(code, state);
        return result.map(login -> {
            LOG.infof("Login completed for %s", login.session().subject());
            return Response.status(Response.Status.FOUND)
                    .location(URI.create(login.redirectTarget()))
                    .cookie(cookies.createCookie(login.session()))
                    .build();
        });
    }

    /**
     * First logout stage.
     */
    @GET
    @Path("/logout")
    public Uni<Response> logout(@Context HttpServerRequest request) {
        final var sessionId = cookies.extractSessionId(request);
        if (sessionId.isEmpty()) {
            return Uni.createFrom().item(localLogoutResponse());
        }
        return flow.beginLogout(sessionId.get()).map(this::toResponse);
    }

    /**
     * Second logout stage, reached from the provider's post-logout redirect.
     */
    @GET
    @Path("/logout/complete")
    public Uni<Response> completeLogout(@Context HttpServerRequest request) {
        final var sessionId = cookies.extractSessionId(request);
        if (sessionId.isEmpty()) {
            return Uni.createFrom().item(localLogoutResponse());
        }
        return flow.completeLogout(sessionId.get()).map(this::toResponse);
    }

    /**
     * Current identity and the CSRF token for script clients.
     */
    @GET
    @Path("/session")
    public Uni<SessionInfoDto> session(@Context HttpServerRequest request) {
        return guard.requireSession(request).map(session -> SessionInfoDto.fromModel(session, csrf.tokenFor(session)));
    }

    private Response toResponse(LogoutPlan plan) {
        return plan.providerLogout()
                .map(uri -> Response.status(Response.Status.FOUND).location(uri).build())
                .orElseGet(this::localLogoutResponse);
    }

    private Response localLogoutResponse() {
        return Response.status(Response.Status.FOUND)
                .location(HOME)
                .cookie(cookies.createLogoutCookie())
                .build();
    }
}
