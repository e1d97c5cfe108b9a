package vpnmanager.core.model.auth;

/**
 * Operations guarded by the access control layer.
 */
public enum Action {
    VIEW_OWN_CERTIFICATES(false),
    READ_CERTIFICATE(false),
    REVOKE_CERTIFICATE(false),
    ISSUE_CLIENT_CERTIFICATE(false),
    VIEW_TRANSPARENCY_LOG(false),
    SEARCH_ALL_CERTIFICATES(true),
    MANAGE_PSK(true),
    ADMIN_PAGE(true);

    private final boolean adminOnly;

    Action(boolean adminOnly) {
        this.adminOnly = adminOnly;
    }

    /**
     * Whether the action requires the {@link Role#ADMIN} role regardless of ownership.
     */
    public boolean adminOnly() {
        return adminOnly;
    }
}
