package vpnmanager.core.model.auth;

/**
 * Roles an authenticated identity can hold.
 *
 * <p>Roles are derived from identity provider group claims at login time and
 * stored on the session. They are re-read on every authorization decision.
 */
public enum Role {
    USER,
    ADMIN
}
