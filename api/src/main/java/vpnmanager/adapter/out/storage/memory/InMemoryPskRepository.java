package vpnmanager.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.port.out.PskRepository;

/**
 * In-memory implementation of PskRepository.
 *
 * <p>Thread-safety: Uses explicit synchronization to keep the id and hash indexes
 * consistent during saves. The hash index holds ids only; field updates are
 * atomic per id through {@code computeIfPresent}.
 */
@ApplicationScoped
public class InMemoryPskRepository implements PskRepository {

    private final ConcurrentHashMap<String, Psk> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idsByHash = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Uni<Void> save(Psk psk) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                final var previous = storageById.put(psk.id(), psk);
                if (previous != null && !previous.keyHash().equals(psk.keyHash())) {
                    idsByHash.remove(previous.keyHash());
                }
                idsByHash.put(psk.keyHash(), psk.id());
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<Psk>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(id)));
    }

    @Override
    public Uni<Optional<Psk>> findByHash(String keyHash) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(idsByHash.get(keyHash)).map(storageById::get));
    }

    @Override
    public Uni<Optional<Psk>> markRevoked(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(
                storageById.computeIfPresent(id, (key, stored) -> stored.revoked() ? stored : stored.revoke())));
    }

    @Override
    public Uni<Optional<Psk>> touchLastUsed(String id, Instant usedAt) {
        return Uni.createFrom().item(() -> Optional.ofNullable(
                storageById.computeIfPresent(id, (key, stored) -> stored.withLastUsedAt(usedAt))));
    }

    @Override
    public Uni<List<Psk>> findAll() {
        return Uni.createFrom().item(() -> {
            final List<Psk> all = new ArrayList<>(storageById.values());
            all.sort(Comparator.comparing(Psk::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .reversed());
            return all;
        });
    }
}
