package vpnmanager.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.auth.OidcExchange;

/**
 * Outbound port for pending OIDC login exchanges.
 */
public interface OidcExchangeRepository {

    /**
     * Stores an exchange under its state id until {@link OidcExchange#expiresAt()}.
     */
    Uni<Void> store(OidcExchange exchange);

    /**
     * Retrieves and removes an exchange in one atomic step.
     *
     * <p>Of any number of concurrent calls with the same state, at most one
     * receives the exchange. Expired exchanges are never returned.
     *
     * @param stateId the OAuth state value
     * @return the exchange, or empty if unknown, expired or already consumed
     */
    Uni<Optional<OidcExchange>> consume(String stateId);
}
