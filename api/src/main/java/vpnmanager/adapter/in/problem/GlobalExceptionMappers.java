package vpnmanager.adapter.in.problem;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import vpnmanager.core.exception.LoginRequiredException;
import vpnmanager.core.exception.PskException;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.exception.VpnManagerException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    static final String LOGIN_PATH = "/auth/login";

    @ServerExceptionMapper
    public Response mapLoginRequired(LoginRequiredException e, ContainerRequestContext request) {
        if (isBrowserNavigation(request)) {
            final var target = e.returnTo() == null ? "/" : e.returnTo();
            final var location = LOGIN_PATH + "?next=" + URLEncoder.encode(target, StandardCharsets.UTF_8);
            return Response.status(Response.Status.FOUND)
                    .location(URI.create(location))
                    .build();
        }
        return toResponse(ProblemMapping.toProblem(e));
    }

    @ServerExceptionMapper
    public Response mapVpnManagerException(VpnManagerException e) {
        if (e instanceof PskException psk) {
            LOG.debugf("Machine credential rejected: %s", psk.reason());
        } else if (e instanceof UpstreamException upstream) {
            LOG.warnf("Upstream failure from %s: %s", upstream.upstream(), upstream.reason());
        } else {
            LOG.debugf("Request rejected: %s", e.getClass().getSimpleName());
        }
        return toResponse(ProblemMapping.toProblem(e));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(VpnProblem.badRequest("The request is malformed"));
    }

    static boolean isBrowserNavigation(ContainerRequestContext request) {
        if (!"GET".equals(request.getMethod()) && !"HEAD".equals(request.getMethod())) {
            return false;
        }
        final var accept = request.getHeaderString(HttpHeaders.ACCEPT);
        return accept != null && accept.contains("text/html");
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
