package vpnmanager.core.model.profile;

import java.util.OptionalInt;

/**
 * User-selected overrides for a client profile.
 *
 * @param useTcp connect over TCP instead of the template's protocol
 * @param customPort port to use instead of the template's port
 */
public record ProfileOptions(boolean useTcp, OptionalInt customPort) {

    public ProfileOptions {
        customPort = customPort == null ? OptionalInt.empty() : customPort;
    }

    public static ProfileOptions defaults() {
        return new ProfileOptions(false, OptionalInt.empty());
    }
}
