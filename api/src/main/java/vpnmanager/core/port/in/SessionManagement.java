package vpnmanager.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.session.Session;

/**
 * Inbound port for session management operations.
 */
public interface SessionManagement {

    /**
     * Creates a new session for an identity that just logged in.
     *
     * <p>Generates a unique session ID with collision detection and retries up to
     * the configured maximum.
     *
     * @param claims verified ID token claims
     * @param idToken raw ID token kept as the logout hint
     * @return The created session
     * @throws SessionCreationException if session creation fails after max retries
     */
    Uni<Session> createSession(IdTokenClaims claims, String idToken);

    /**
     * Retrieves a session that may authenticate a request, refreshing its last access time.
     *
     * @param sessionId Session identifier, may be null
     * @return The valid session, or empty if absent, expired, idle or logging out
     */
    Uni<Optional<Session>> resolve(String sessionId);

    /**
     * Looks up a session without validity checks or refresh.
     *
     * @param sessionId Session identifier, may be null
     * @return The stored session, or empty if absent
     */
    Uni<Optional<Session>> find(String sessionId);

    /**
     * Flags a session as logging out.
     *
     * @return the flagged session, or empty if it does not exist
     */
    Uni<Optional<Session>> markLogoutPending(String sessionId);

    /**
     * Invalidates a single session.
     */
    Uni<Void> invalidateSession(String sessionId);

    /**
     * Exception thrown when session creation fails.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }
    }
}
