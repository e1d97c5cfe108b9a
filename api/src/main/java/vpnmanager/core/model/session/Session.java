package vpnmanager.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

import vpnmanager.core.model.auth.Role;

/**
 * Represents an authenticated browser session.
 *
 * <p>Sessions are created when a user completes the OIDC login flow. The session is
 * stored server-side and only its opaque identifier travels in a cookie.
 *
 * @param id Unique session identifier (cryptographically secure)
 * @param subject Identity subject from the ID token; never changes for a given id
 * @param displayName Human readable name
 * @param email Email claim (optional)
 * @param groups Group memberships reported by the identity provider
 * @param roles Roles derived from the groups
 * @param createdAt Session creation timestamp
 * @param expiresAt Absolute expiration timestamp
 * @param lastAccessedAt Last activity timestamp (for idle timeout)
 * @param csrfSecret Per-session secret the CSRF token is derived from
 * @param idTokenHint Raw ID token, replayed to the provider on logout
 * @param logoutPending True once provider logout has started; the session no longer authenticates
 */
public record Session(
        String id,
        String subject,
        String displayName,
        String email,
        Set<String> groups,
        Set<Role> roles,
        Instant createdAt,
        Instant expiresAt,
        Instant lastAccessedAt,
        String csrfSecret,
        String idTokenHint,
        boolean logoutPending) {

    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(csrfSecret, "csrfSecret");
        groups = groups == null ? Set.of() : Set.copyOf(groups);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    /**
     * Creates a new session with updated lastAccessedAt timestamp.
     */
    public Session withLastAccessedAt(Instant lastAccessedAt) {
        return new Session(
                id,
                subject,
                displayName,
                email,
                groups,
                roles,
                createdAt,
                expiresAt,
                lastAccessedAt,
                csrfSecret,
                idTokenHint,
                logoutPending);
    }

    /**
     * Creates a new session with a different ID.
     */
    public Session withId(String id) {
        return new Session(
                id,
                subject,
                displayName,
                email,
                groups,
                roles,
                createdAt,
                expiresAt,
                lastAccessedAt,
                csrfSecret,
                idTokenHint,
                logoutPending);
    }

    /**
     * Creates a copy marked as logging out.
     */
    public Session asLogoutPending() {
        return new Session(
                id,
                subject,
                displayName,
                email,
                groups,
                roles,
                createdAt,
                expiresAt,
                lastAccessedAt,
                csrfSecret,
                idTokenHint,
                true);
    }

    public boolean isAdmin() {
        return roles.contains(Role.ADMIN);
    }

    /**
     * Checks if the session has expired.
     */
    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    /**
     * Checks if the session has exceeded the idle timeout.
     *
     * @param idleTimeout Maximum duration of inactivity
     */
    public boolean isIdle(Duration idleTimeout) {
        if (lastAccessedAt == null || idleTimeout == null) {
            return false;
        }
        return Instant.now().isAfter(lastAccessedAt.plus(idleTimeout));
    }

    /**
     * Checks if the session may authenticate a request.
     *
     * @param idleTimeout Maximum duration of inactivity (null to skip idle check)
     */
    public boolean isValid(Duration idleTimeout) {
        return !logoutPending && !isExpired() && (idleTimeout == null || !isIdle(idleTimeout));
    }

    @Override
    public String toString() {
        return "Session[subject=" + subject + ", roles=" + roles + ", expiresAt=" + expiresAt + "]";
    }
}
