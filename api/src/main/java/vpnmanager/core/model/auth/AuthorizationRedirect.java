package vpnmanager.core.model.auth;

import java.net.URI;

/**
 * Where to send the browser to start an OIDC login, plus the state that identifies the exchange.
 */
public record AuthorizationRedirect(URI location, String stateId) {}
