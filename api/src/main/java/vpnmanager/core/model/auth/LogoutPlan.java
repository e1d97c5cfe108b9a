package vpnmanager.core.model.auth;

import java.net.URI;
import java.util.Optional;

/**
 * Result of the first logout stage.
 *
 * <p>When {@code providerLogout} is present the browser must visit it before the
 * local session is destroyed. When empty the local session has already been removed.
 */
public record LogoutPlan(Optional<URI> providerLogout) {

    public static LogoutPlan local() {
        return new LogoutPlan(Optional.empty());
    }

    public static LogoutPlan viaProvider(URI uri) {
        return new LogoutPlan(Optional.of(uri));
    }
}
