package vpnmanager.adapter.in.problem;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;

import vpnmanager.core.exception.AccessDeniedException;
import vpnmanager.core.exception.AuthenticationException;
import vpnmanager.core.exception.CsrfException;
import vpnmanager.core.exception.DuplicateSubmissionException;
import vpnmanager.core.exception.LoginRequiredException;
import vpnmanager.core.exception.PskException;
import vpnmanager.core.exception.ResourceNotFoundException;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.exception.VpnManagerException;
import vpnmanager.core.model.auth.DenyReason;

/**
 * Turns every core exception into its problem document.
 *
 * <p>Ownership denials and missing resources share {@link VpnProblem#notFound()} so
 * a caller cannot tell a foreign certificate from a nonexistent one.
 */
public final class ProblemMapping {

    private ProblemMapping() {}

    public static HttpProblem toProblem(VpnManagerException e) {
        if (e instanceof ResourceNotFoundException) {
            return VpnProblem.notFound();
        }
        if (e instanceof AccessDeniedException denied) {
            return denied.reason() == DenyReason.NOT_OWNER
                    ? VpnProblem.notFound()
                    : VpnProblem.forbidden("Administrator role required");
        }
        if (e instanceof AuthenticationException auth) {
            return switch (auth.reason()) {
                case INVALID_STATE -> VpnProblem.invalidLoginState();
                case NONCE_MISMATCH -> VpnProblem.unauthorized("Login could not be completed");
                case SESSION_EXPIRED -> VpnProblem.unauthorized("Session expired");
            };
        }
        if (e instanceof LoginRequiredException) {
            return VpnProblem.unauthorized("Authentication required");
        }
        if (e instanceof CsrfException) {
            return VpnProblem.csrfRejected();
        }
        if (e instanceof PskException psk) {
            return VpnProblem.unauthorized(psk.getMessage());
        }
        if (e instanceof UpstreamException upstream) {
            return upstream.retryable()
                    ? VpnProblem.gatewayTimeout(upstream.getMessage())
                    : VpnProblem.badGateway(upstream.getMessage());
        }
        if (e instanceof ValidationException validation) {
            return VpnProblem.validationError(validation.field(), validation.getMessage());
        }
        if (e instanceof DuplicateSubmissionException) {
            return VpnProblem.conflict(e.getMessage());
        }
        return VpnProblem.internalError("Unexpected error");
    }
}
