package vpnmanager.core.service.routing;

import java.net.URI;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import vpnmanager.core.config.ServiceConfig;
import vpnmanager.core.model.routing.RouteScope;
import vpnmanager.core.model.routing.RoutingDecision;
import vpnmanager.core.model.routing.ServiceMode;

/**
 * Decides whether this instance serves a request, redirects it to its counterpart,
 * or reports the route as unavailable.
 *
 * <table>
 *   <caption>Decisions by mode and scope</caption>
 *   <tr><th>mode</th><th>admin scope</th><th>user scope</th></tr>
 *   <tr><td>combined</td><td>serve</td><td>serve</td></tr>
 *   <tr><td>user-only</td><td>301 to admin (pages only) or unavailable</td><td>serve</td></tr>
 *   <tr><td>admin-only</td><td>serve</td><td>301 to user (GET/HEAD) or unavailable</td></tr>
 * </table>
 *
 * <p>Common routes are always served. Redirects keep the path and full query string.
 */
@ApplicationScoped
public class ServiceSeparationRouter {

    private static final Logger LOG = Logger.getLogger(ServiceSeparationRouter.class);

    private final ServiceMode mode;
    private final Optional<String> userServiceUrl;
    private final Optional<String> adminServiceUrl;

    @Inject
    public ServiceSeparationRouter(ServiceConfig config) {
        this(config.mode(), config.userServiceUrl(), config.adminServiceUrl());
    }

    public ServiceSeparationRouter(
            ServiceMode mode, Optional<String> userServiceUrl, Optional<String> adminServiceUrl) {
        this.mode = mode;
        this.userServiceUrl = userServiceUrl.filter(s -> !s.isBlank());
        this.adminServiceUrl = adminServiceUrl.filter(s -> !s.isBlank());
    }

    public ServiceMode mode() {
        return mode;
    }

    /**
     * Routes one request.
     *
     * @param method HTTP method
     * @param path request path
     * @param rawQuery raw (still encoded) query string, may be null
     * @return the decision
     */
    public RoutingDecision route(String method, String path, String rawQuery) {
        final var scope = RouteClassifier.classify(path);
        if (scope == RouteScope.COMMON || mode == ServiceMode.COMBINED) {
            return RoutingDecision.serve();
        }

        if (mode == ServiceMode.USER_ONLY && scope == RouteScope.ADMIN) {
            if (RouteClassifier.isApiPath(path) || !isSafe(method)) {
                return unavailable(scope, path);
            }
            return redirectOrUnavailable(adminServiceUrl, scope, path, rawQuery);
        }

        if (mode == ServiceMode.ADMIN_ONLY && scope == RouteScope.USER) {
            if (!isSafe(method)) {
                return unavailable(scope, path);
            }
            return redirectOrUnavailable(userServiceUrl, scope, path, rawQuery);
        }

        return RoutingDecision.serve();
    }

    private RoutingDecision redirectOrUnavailable(
            Optional<String> counterpart, RouteScope scope, String path, String rawQuery) {
        if (counterpart.isEmpty()) {
            return unavailable(scope, path);
        }
        final var location = counterpartLocation(counterpart.get(), path, rawQuery);
        LOG.debugf("Redirecting %s route %s to %s", scope, path, location);
        return new RoutingDecision.Redirect(location);
    }

    private RoutingDecision unavailable(RouteScope scope, String path) {
        LOG.debugf("%s route %s is not available in %s mode", scope, path, mode.wireName());
        return new RoutingDecision.Unavailable(scope, mode);
    }

    static URI counterpartLocation(String baseUrl, String path, String rawQuery) {
        final var base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        final var target = new StringBuilder(base).append(path.startsWith("/") ? path : "/" + path);
        if (rawQuery != null && !rawQuery.isEmpty()) {
            target.append('?').append(rawQuery);
        }
        return URI.create(target.toString());
    }

    private static boolean isSafe(String method) {
        return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
    }
}
