package vpnmanager.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.model.auth.OidcExchange;
import vpnmanager.core.port.out.OidcExchangeRepository;

/**
 * In-memory storage for pending login exchanges.
 *
 * <p>Consumption is a single {@code remove}, so two callbacks racing on the same
 * state cannot both obtain the exchange.
 */
@ApplicationScoped
public class InMemoryOidcExchangeRepository implements OidcExchangeRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryOidcExchangeRepository.class);

    private final ConcurrentMap<String, OidcExchange> exchanges = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;
    private final Clock clock;

    @Inject
    public InMemoryOidcExchangeRepository() {
        this(Clock.systemUTC());
    }

    InMemoryOidcExchangeRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "oidc-exchange-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory OIDC exchange repository");
    }

    @Override
    public Uni<Void> store(OidcExchange exchange) {
        return Uni.createFrom().item(() -> {
            exchanges.put(exchange.stateId(), exchange);
            LOG.debugf("Stored login exchange expiring at %s", exchange.expiresAt());
            return null;
        });
    }

    @Override
    public Uni<Optional<OidcExchange>> consume(String stateId) {
        return Uni.createFrom().item(() -> {
            if (stateId == null) {
                return Optional.<OidcExchange>empty();
            }
            final var exchange = exchanges.remove(stateId);
            if (exchange == null) {
                LOG.debugf("No login exchange found for presented state");
                return Optional.<OidcExchange>empty();
            }
            if (exchange.isExpired(clock.instant())) {
                LOG.debugf("Login exchange expired");
                return Optional.<OidcExchange>empty();
            }
            return Optional.of(exchange);
        });
    }

    void cleanupExpired() {
        final var now = clock.instant();
        final var before = exchanges.size();

        exchanges.values().removeIf(exchange -> exchange.isExpired(now));

        final var removed = before - exchanges.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired login exchanges", removed);
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
     * Get the current count of pending exchanges (for testing).
     */
    public int getExchangeCount() {
        return exchanges.size();
    }
}
