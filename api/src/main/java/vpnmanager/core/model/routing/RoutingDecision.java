package vpnmanager.core.model.routing;

import java.net.URI;

/**
 * What the service-separation router decided for one request.
 */
public sealed interface RoutingDecision {

    /** Handle the request on this instance. */
    record Serve() implements RoutingDecision {}

    /** Permanently redirect to the counterpart instance. */
    record Redirect(URI location) implements RoutingDecision {}

    /** The route does not exist on this deployment. */
    record Unavailable(RouteScope scope, ServiceMode mode) implements RoutingDecision {}

    static RoutingDecision serve() {
        return new Serve();
    }
}
