package vpnmanager.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import vpnmanager.adapter.in.auth.RequestGuard;
import vpnmanager.adapter.in.dto.SessionInfoDto;
import vpnmanager.core.service.auth.CsrfTokenService;

/**
 * Landing page. Anonymous browsers are sent into the login flow.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class HomeResource {

    private final RequestGuard guard;
    private final CsrfTokenService csrf;

    @Inject
    public HomeResource(RequestGuard guard, CsrfTokenService csrf) {
        this.guard = guard;
        this.csrf = csrf;
    }

    @GET
    public Uni<SessionInfoDto> home(@Context HttpServerRequest request) {
        return guard.requireSession(request).map(session -> SessionInfoDto.fromModel(session, csrf.tokenFor(session)));
    }
}
