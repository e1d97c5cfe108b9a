package vpnmanager.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>Sessions are lost on restart and not shared across instances.
 */
@ApplicationScoped
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemorySessionRepository() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredSessions, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Boolean> saveIfAbsent(Session session) {
        return Uni.createFrom().item(() -> {
            Session existing = sessions.putIfAbsent(session.id(), session);
            if (existing == null) {
                LOG.debugf("Session created for subject %s", session.subject());
                return true;
            }
            LOG.debugf("Session ID collision detected");
            return false;
        });
    }

    @Override
    public Uni<Optional<Session>> touch(String sessionId, Instant lastAccessedAt) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.computeIfPresent(sessionId, (id, stored) -> {
            if (stored.logoutPending()
                    || (stored.lastAccessedAt() != null && !lastAccessedAt.isAfter(stored.lastAccessedAt()))) {
                return stored;
            }
            return stored.withLastAccessedAt(lastAccessedAt);
        })));
    }

    @Override
    public Uni<Optional<Session>> markLogoutPending(String sessionId) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(
                        sessions.computeIfPresent(sessionId, (id, stored) -> stored.asLogoutPending())));
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        // Expiration checking is handled by the service layer
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return Uni.createFrom().item(() -> {
            if (sessions.remove(sessionId) != null) {
                LOG.debugf("Session deleted");
            }
            return null;
        });
    }

    void cleanupExpiredSessions() {
        Instant now = Instant.now();
        int before = sessions.size();
        sessions.values().removeIf(session -> session.expiresAt() != null && now.isAfter(session.expiresAt()));

        int removed = before - sessions.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired sessions", removed);
        }
    }

    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Return the current session count (for testing).
     */
    public int getSessionCount() {
        return sessions.size();
    }
}
