package vpnmanager.core.model.routing;

import java.util.Locale;

/**
 * Deployment mode of a service instance.
 */
public enum ServiceMode {
    /** One instance serves every route. */
    COMBINED,
    /** Serves user routes; admin routes live on the counterpart. */
    USER_ONLY,
    /** Serves admin routes; user routes live on the counterpart. */
    ADMIN_ONLY;

    /**
     * Header value form, e.g. {@code user-only}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
