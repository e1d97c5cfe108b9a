package vpnmanager.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import vpnmanager.adapter.out.storage.memory.InMemorySessionRepository;
import vpnmanager.core.config.SessionConfig;
import vpnmanager.core.model.auth.IdTokenClaims;
import vpnmanager.core.model.auth.Role;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.SessionManagement.SessionCreationException;
import vpnmanager.core.service.auth.RoleMapper;
import vpnmanager.core.service.auth.RoleMapperAccess;
import vpnmanager.core.service.auth.SecureTokenGenerator;

@DisplayName("SessionService")
class SessionServiceTest {

    private InMemorySessionRepository repository;
    private SessionConfig config;
    private SessionConfig.IdGenerationConfig idGeneration;
    private SessionService service;

    private static final IdTokenClaims ALICE =
            new IdTokenClaims("alice", "nonce", "Alice", "alice@example.com", List.of("staff", "Admins"));

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository();
        config = mock(SessionConfig.class);
        idGeneration = mock(SessionConfig.IdGenerationConfig.class);
        when(config.ttl()).thenReturn(Duration.ofHours(8));
        when(config.idleTimeout()).thenReturn(Duration.ofMinutes(30));
        when(config.slidingExpiration()).thenReturn(true);
        when(config.idGeneration()).thenReturn(idGeneration);
        when(idGeneration.maxRetries()).thenReturn(3);

        service = new SessionService(repository, new SecureTokenGenerator(), roleMapper(), config);
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    private static RoleMapper roleMapper() {
        return RoleMapperAccess.withAdminGroups("admins");
    }

    private Session store(Session session) {
        repository.saveIfAbsent(session).await().indefinitely();
        return session;
    }

    private static Session session(String id, Instant createdAt, Instant expiresAt, Instant lastAccessedAt) {
        return new Session(
                id, "bob", "Bob", null, Set.of(), Set.of(Role.USER), createdAt, expiresAt, lastAccessedAt, "secret",
                null, false);
    }

    @Nested
    @DisplayName("createSession()")
    class CreateSessionTests {

        @Test
        @DisplayName("should derive roles from groups case-insensitively")
        void shouldDeriveRoles() {
            Session session = service.createSession(ALICE, "raw").await().indefinitely();

            assertEquals(Set.of(Role.USER, Role.ADMIN), session.roles());
            assertEquals("alice", session.subject());
            assertEquals("raw", session.idTokenHint());
        }

        @Test
        @DisplayName("should set absolute expiry from configured TTL")
        void shouldSetAbsoluteExpiry() {
            Session session = service.createSession(ALICE, "raw").await().indefinitely();

            assertEquals(Duration.ofHours(8), Duration.between(session.createdAt(), session.expiresAt()));
        }

        @Test
        @DisplayName("should issue a fresh id and CSRF secret per session")
        void shouldIssueFreshValues() {
            Session first = service.createSession(ALICE, "raw").await().indefinitely();
            Session second = service.createSession(ALICE, "raw").await().indefinitely();

            assertNotEquals(first.id(), second.id());
            assertNotEquals(first.csrfSecret(), second.csrfSecret());
            assertEquals(2, repository.getSessionCount());
        }

        @Test
        @DisplayName("should fail after repeated id collisions")
        void shouldFailAfterCollisions() {
            var tokens = mock(SecureTokenGenerator.class);
            when(tokens.sessionId()).thenReturn("fixed-id");
            when(tokens.secret()).thenReturn("secret");
            var colliding = new SessionService(repository, tokens, roleMapper(), config);

            colliding.createSession(ALICE, "raw").await().indefinitely();

            assertThrows(SessionCreationException.class, () -> colliding
                    .createSession(ALICE, "raw")
                    .await()
                    .indefinitely());
        }
    }

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("should slide last access without extending absolute expiry")
        void shouldSlideIdleWindowOnly() {
            var now = Instant.now();
            var stored = store(session("s1", now.minusSeconds(600), now.plusSeconds(3600), now.minusSeconds(300)));

            var resolved = service.resolve("s1").await().indefinitely();

            assertTrue(resolved.isPresent());
            assertTrue(resolved.get().lastAccessedAt().isAfter(stored.lastAccessedAt()));
            assertEquals(stored.expiresAt(), resolved.get().expiresAt());
        }

        @Test
        @DisplayName("should not touch last access when sliding expiration is off")
        void shouldNotSlideWhenDisabled() {
            when(config.slidingExpiration()).thenReturn(false);
            var now = Instant.now();
            var stored = store(session("s1", now, now.plusSeconds(3600), now.minusSeconds(60)));

            var resolved = service.resolve("s1").await().indefinitely();

            assertEquals(stored.lastAccessedAt(), resolved.get().lastAccessedAt());
        }

        @Test
        @DisplayName("should drop sessions past absolute expiry")
        void shouldDropExpired() {
            var now = Instant.now();
            store(session("s1", now.minusSeconds(7200), now.minusSeconds(1), now.minusSeconds(2)));

            assertTrue(service.resolve("s1").await().indefinitely().isEmpty());
            assertTrue(repository.findById("s1").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should drop idle sessions")
        void shouldDropIdle() {
            var now = Instant.now();
            store(session("s1", now.minusSeconds(7200), now.plusSeconds(3600), now.minusSeconds(1801)));

            assertTrue(service.resolve("s1").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should not authenticate with a logout-pending session but keep it stored")
        void shouldRejectLogoutPending() {
            var now = Instant.now();
            store(session("s1", now, now.plusSeconds(3600), now).asLogoutPending());

            assertTrue(service.resolve("s1").await().indefinitely().isEmpty());
            assertTrue(service.find("s1").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should not revive a session whose logout began while it was being resolved")
        void shouldKeepLogoutStartedDuringResolve() {
            var now = Instant.now();
            var racing = new InMemorySessionRepository() {
                @Override
                public Uni<Optional<Session>> findById(String sessionId) {
                    return super.findById(sessionId).call(found -> markLogoutPending(sessionId));
                }
            };
            try {
                racing.saveIfAbsent(session("s1", now, now.plusSeconds(3600), now.minusSeconds(60)))
                        .await()
                        .indefinitely();
                var racingService = new SessionService(racing, new SecureTokenGenerator(), roleMapper(), config);

                assertTrue(racingService.resolve("s1").await().indefinitely().isEmpty());
                assertTrue(racingService.resolve("s1").await().indefinitely().isEmpty());
                assertEquals(1, racing.getSessionCount());
            } finally {
                racing.shutdown();
            }
        }

        @Test
        @DisplayName("should return empty for blank id")
        void shouldReturnEmptyForBlank() {
            assertTrue(service.resolve(" ").await().indefinitely().isEmpty());
            assertTrue(service.resolve(null).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("markLogoutPending() and invalidateSession()")
    class LogoutTests {

        @Test
        @DisplayName("should flag then delete the session")
        void shouldFlagThenDelete() {
            Session session = service.createSession(ALICE, "raw").await().indefinitely();

            var pending = service.markLogoutPending(session.id()).await().indefinitely();
            assertTrue(pending.get().logoutPending());

            service.invalidateSession(session.id()).await().indefinitely();
            assertFalse(service.find(session.id()).await().indefinitely().isPresent());
        }
    }
}
