package vpnmanager.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import vpnmanager.adapter.in.problem.VpnProblem;
import vpnmanager.core.model.routing.RoutingDecision;
import vpnmanager.core.service.routing.ServiceSeparationRouter;

/**
 * Applies the deployment mode before resource matching.
 *
 * <p>Routes owned by the counterpart deployment are redirected there (301) or
 * answered with a route-unavailable problem carrying an {@code X-Service-Mode}
 * header. Returning a null item continues normal processing.
 */
public class ServiceSeparationFilter {

    private static final Logger LOG = Logger.getLogger(ServiceSeparationFilter.class);

    private final ServiceSeparationRouter router;

    @Inject
    public ServiceSeparationFilter(ServiceSeparationRouter router) {
        this.router = router;
    }

    @ServerRequestFilter(preMatching = true, priority = Priorities.AUTHENTICATION - 100)
    public Uni<Response> filter(ContainerRequestContext requestContext) {
        final var uri = requestContext.getUriInfo().getRequestUri();
        final var decision = router.route(requestContext.getMethod(), uri.getRawPath(), uri.getRawQuery());

        if (decision instanceof RoutingDecision.Redirect redirect) {
            LOG.debugf("Redirecting %s to counterpart service", uri.getRawPath());
            return Uni.createFrom()
                    .item(Response.status(Response.Status.MOVED_PERMANENTLY)
                            .location(redirect.location())
                            .build());
        }
        if (decision instanceof RoutingDecision.Unavailable unavailable) {
            LOG.debugf("Route %s is not served in %s mode", uri.getRawPath(), unavailable.mode().wireName());
            final var problem = VpnProblem.routeUnavailable(unavailable.mode());
            return Uni.createFrom()
                    .item(Response.status(problem.getStatus())
                            .type("application/problem+json")
                            .header(VpnProblem.SERVICE_MODE_HEADER, unavailable.mode().wireName())
                            .entity(problem)
                            .build());
        }
        return Uni.createFrom().nullItem();
    }
}
