package vpnmanager.adapter.in.problem;

import java.net.URI;

import jakarta.ws.rs.core.Response.Status;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;

import vpnmanager.core.model.routing.ServiceMode;

/**
 * RFC 7807 Problem Details factory for VPN manager errors.
 *
 * <p>Details are fixed strings or validated field names. Nothing the caller sent is
 * echoed back except through {@link #validationError}, whose detail is built by the core.
 */
public final class VpnProblem {

    public static final URI ROUTE_UNAVAILABLE_TYPE = URI.create("urn:vpn-manager:problem:route-unavailable");
    public static final String SERVICE_MODE_HEADER = "X-Service-Mode";

    private VpnProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Not Found Errors ==========

    /**
     * The one body used for unknown, malformed and foreign resources alike.
     */
    public static HttpProblem notFound() {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("The requested resource was not found")
                .build();
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String field, String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .with("field", field)
                .build();
    }

    public static HttpProblem csrfRejected() {
        return HttpProblem.builder()
                .withTitle("CSRF Verification Failed")
                .withStatus(Status.BAD_REQUEST)
                .withDetail("The request could not be verified. Reload the page and try again.")
                .build();
    }

    public static HttpProblem invalidLoginState() {
        return HttpProblem.builder()
                .withTitle("Invalid Login State")
                .withStatus(Status.BAD_REQUEST)
                .withDetail("The login attempt is unknown or has expired. Start a new login.")
                .build();
    }

    // ========== Authentication/Authorization Errors ==========

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    /**
     * The route exists but this deployment does not serve it.
     */
    public static HttpProblem routeUnavailable(ServiceMode mode) {
        return HttpProblem.builder()
                .withType(ROUTE_UNAVAILABLE_TYPE)
                .withTitle("Route Unavailable")
                .withStatus(Status.FORBIDDEN)
                .withDetail("This route is not served by the %s service".formatted(mode.wireName()))
                .with("serviceMode", mode.wireName())
                .build();
    }

    // ========== Conflict Errors ==========

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    // ========== Upstream Errors ==========

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .with("retryable", false)
                .build();
    }

    public static HttpProblem gatewayTimeout(String detail) {
        return HttpProblem.builder()
                .withTitle("Gateway Timeout")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(detail)
                .with("retryable", true)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
