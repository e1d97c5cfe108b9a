package vpnmanager.core.model.auth;

import vpnmanager.core.model.session.Session;

/**
 * Outcome of a successful callback: the new session and where to send the browser.
 */
public record LoginResult(Session session, String redirectTarget) {}
