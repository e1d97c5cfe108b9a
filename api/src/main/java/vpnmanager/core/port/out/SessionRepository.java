package vpnmanager.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.session.Session;

/**
 * Outbound port for session storage.
 *
 * <p>Implementations must be atomic per session id. Changes are applied to the
 * stored session; callers never write back a session they read earlier.
 */
public interface SessionRepository {

    /**
     * Saves a session only if its ID is not already taken.
     *
     * @param session Session to save
     * @return true if saved, false if the ID already exists
     */
    Uni<Boolean> saveIfAbsent(Session session);

    /**
     * Moves the last access time of a stored session forward. A session flagged for
     * logout is left unchanged.
     *
     * @param sessionId Session identifier
     * @param lastAccessedAt access time to record
     * @return the stored session after the change, or empty if it no longer exists
     */
    Uni<Optional<Session>> touch(String sessionId, Instant lastAccessedAt);

    /**
     * Flags a stored session as logging out. The flag is never cleared.
     *
     * @param sessionId Session identifier
     * @return the flagged session, or empty if it no longer exists
     */
    Uni<Optional<Session>> markLogoutPending(String sessionId);

    /**
     * Retrieves a session by ID.
     *
     * @param sessionId Session identifier
     * @return The session, or empty if not found
     */
    Uni<Optional<Session>> findById(String sessionId);

    /**
     * Deletes a session.
     *
     * @param sessionId Session identifier
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String sessionId);
}
