package vpnmanager.core.model.routing;

/**
 * Which capability surface a request path belongs to.
 */
public enum RouteScope {
    /** Served by every instance: health, login, logout, landing page. */
    COMMON,
    USER,
    ADMIN
}
