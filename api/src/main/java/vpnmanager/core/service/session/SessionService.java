package vpnmanager.core.service.session;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.config.SessionConfig;
import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.SessionManagement;
import vpnmanager.core.port.out.SessionRepository;
import vpnmanager.core.service.auth.RoleMapper;
import vpnmanager.core.service.auth.SecureTokenGenerator;
import vpnmanager.core.util.SecureHash;

/**
 * Implementation of session management operations.
 *
 * <p>Handles session lifecycle including creation with collision retry,
 * validation on every request, idle tracking and invalidation. The absolute
 * expiry set at creation is never extended.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final SessionRepository repository;
    private final SecureTokenGenerator tokens;
    private final RoleMapper roleMapper;
    private final SessionConfig config;

    @Inject
    public SessionService(
            SessionRepository repository, SecureTokenGenerator tokens, RoleMapper roleMapper, SessionConfig config) {
        this.repository = repository;
        this.tokens = tokens;
        this.roleMapper = roleMapper;
        this.config = config;
    }

    @Override
    public Uni<Session> createSession(IdTokenClaims claims, String idToken) {
        Instant now = Instant.now();
        return createSessionWithRetry(claims, idToken, now, 0);
    }

    private Uni<Session> createSessionWithRetry(IdTokenClaims claims, String idToken, Instant createdAt, int attempt) {
        int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        Session session = new Session(
                tokens.sessionId(),
                claims.subject(),
                claims.displayName(),
                claims.email(),
                Set.copyOf(claims.groups()),
                roleMapper.rolesFor(claims.groups()),
                createdAt,
                createdAt.plus(config.ttl()),
                createdAt,
                tokens.secret(),
                idToken,
                false);

        return repository.saveIfAbsent(session).flatMap(saved -> {
            if (saved) {
                LOG.infof(
                        "Session %s created for %s with roles %s",
                        SecureHash.truncatedSha256(session.id(), 12), session.subject(), session.roles());
                return Uni.createFrom().item(session);
            }

            LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createSessionWithRetry(claims, idToken, createdAt, attempt + 1);
        });
    }

    @Override
    public Uni<Optional<Session>> resolve(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findById(sessionId).flatMap(sessionOpt -> {
            if (sessionOpt.isEmpty()) {
                return Uni.createFrom().item(Optional.<Session>empty());
            }

            Session session = sessionOpt.get();

            if (!session.isValid(config.idleTimeout())) {
                // Logout-pending sessions stay until the provider sends the browser back.
                if (!session.logoutPending()) {
                    LOG.debugf(
                            "Session %s is expired or idle", SecureHash.truncatedSha256(sessionId, 12));
                    repository
                            .delete(sessionId)
                            .subscribe()
                            .with(
                                    v -> LOG.debugf("Cleaned up invalid session"),
                                    e -> LOG.warnf("Failed to clean up session: %s", e.getMessage()));
                }
                return Uni.createFrom().item(Optional.<Session>empty());
            }

            if (!config.slidingExpiration()) {
                return Uni.createFrom().item(Optional.of(session));
            }
            // Logout may have begun since the read above.
            return repository
                    .touch(sessionId, Instant.now())
                    .map(touched -> touched.filter(stored -> !stored.logoutPending()));
        });
    }

    @Override
    public Uni<Optional<Session>> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findById(sessionId);
    }

    @Override
    public Uni<Optional<Session>> markLogoutPending(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.markLogoutPending(sessionId);
    }

    @Override
    public Uni<Void> invalidateSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().voidItem();
        }
        LOG.infof("Invalidating session: %s", SecureHash.truncatedSha256(sessionId, 12));
        return repository.delete(sessionId);
    }
}
