package vpnmanager.core.port.in;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.model.psk.PskCreateResult;
import vpnmanager.core.model.psk.PskType;
import vpnmanager.core.model.session.Session;

/**
 * Inbound port for pre-shared key administration and validation.
 */
public interface PskManagement {

    /**
     * Creates a key. The plaintext is only available in the returned result.
     *
     * @param description what the key is for
     * @param type certificate type the key may mint
     * @param templateSet profile template set, null for the default
     * @param ttl lifetime, null for no expiry
     * @param admin the creating session; must hold the admin role
     */
    Uni<PskCreateResult> create(String description, PskType type, String templateSet, Duration ttl, Session admin);

    /**
     * Lists keys with hashes redacted.
     */
    Uni<List<Psk>> list(Session admin);

    /**
     * Retrieves one key with its hash redacted.
     */
    Uni<Psk> get(String id, Session admin);

    /**
     * Revokes a key.
     *
     * @return the redacted revoked key
     */
    Uni<Psk> revoke(String id, Session admin);

    /**
     * Validates a presented secret for a required key type.
     *
     * @param candidate the presented secret, never logged
     * @param requiredType the type the calling endpoint needs
     * @return the stored key
     */
    Uni<Psk> validate(String candidate, PskType requiredType);
}
