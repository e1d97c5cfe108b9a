package vpnmanager.core.model.auth;

/**
 * Why an authorization decision denied access.
 */
public enum DenyReason {
    /** The resource belongs to another identity. Rendered exactly like a missing resource. */
    NOT_OWNER,
    /** The action requires a role the identity does not hold. */
    INSUFFICIENT_ROLE
}
