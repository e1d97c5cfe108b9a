package vpnmanager.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.psk.Psk;

/**
 * Outbound port for pre-shared key storage.
 *
 * <p>Revocation and usage tracking change the stored key in place, so neither can
 * undo the other.
 */
public interface PskRepository {

    /**
     * Saves or replaces a key.
     */
    Uni<Void> save(Psk psk);

    Uni<Optional<Psk>> findById(String id);

    /**
     * Revokes a stored key. Revocation is never undone.
     *
     * @return the stored key after revocation, or empty if there is no such key
     */
    Uni<Optional<Psk>> markRevoked(String id);

    /**
     * Records a successful use of a stored key. Every other field is kept as stored.
     *
     * @return the stored key after the change, or empty if there is no such key
     */
    Uni<Optional<Psk>> touchLastUsed(String id, Instant usedAt);

    /**
     * Looks up a key by the SHA-256 hash of its secret.
     */
    Uni<Optional<Psk>> findByHash(String keyHash);

    Uni<List<Psk>> findAll();
}
