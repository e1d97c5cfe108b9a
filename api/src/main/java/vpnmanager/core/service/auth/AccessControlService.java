package vpnmanager.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import vpnmanager.core.exception.AccessDeniedException;
import vpnmanager.core.model.auth.AccessDecision;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.auth.DenyReason;
import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.session.Session;

/**
 * The single authorization check in front of every sensitive operation.
 *
 * <p>Rules:
 * <ul>
 *   <li>Admin-only actions require {@link vpnmanager.core.model.auth.Role#ADMIN}.</li>
 *   <li>Actions on a specific certificate require the caller to own it, unless the caller is an admin.</li>
 *   <li>Everything else is allowed for any valid session.</li>
 * </ul>
 *
 * <p>Decisions are recomputed on every call from the session's current roles.
 */
@ApplicationScoped
public class AccessControlService {

    private static final Logger LOG = Logger.getLogger(AccessControlService.class);

    /**
     * Evaluates an action.
     *
     * @param session the caller
     * @param action what the caller wants to do
     * @param resource the certificate acted upon, or null for actions without a specific target
     * @return the decision
     */
    public AccessDecision authorize(Session session, Action action, Certificate resource) {
        if (session == null) {
            return AccessDecision.deny(DenyReason.INSUFFICIENT_ROLE);
        }
        if (action.adminOnly()) {
            return session.isAdmin() ? AccessDecision.allow() : AccessDecision.deny(DenyReason.INSUFFICIENT_ROLE);
        }
        if (resource == null || session.isAdmin()) {
            return AccessDecision.allow();
        }
        return resource.isOwnedBy(session.subject())
                ? AccessDecision.allow()
                : AccessDecision.deny(DenyReason.NOT_OWNER);
    }

    public AccessDecision authorize(Session session, Action action) {
        return authorize(session, action, null);
    }

    /**
     * Evaluates an action and throws on denial.
     *
     * @throws AccessDeniedException if the decision is a denial
     */
    public void require(Session session, Action action, Certificate resource) {
        final var decision = authorize(session, action, resource);
        if (decision instanceof AccessDecision.Deny deny) {
            LOG.debugf(
                    "Denied %s for subject %s: %s",
                    action, session == null ? "anonymous" : session.subject(), deny.reason());
            throw new AccessDeniedException(deny.reason());
        }
    }

    public void require(Session session, Action action) {
        require(session, action, null);
    }
}
