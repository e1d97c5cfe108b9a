package vpnmanager.core.model.auth;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the OIDC relying-party login flow.
 *
 * <p>{@link #AUTH_FAILED} and {@link #AUTHENTICATED} are terminal for a single
 * exchange. An authenticated session whose validity lapses starts over at
 * {@link #UNAUTHENTICATED}.
 */
public enum OidcFlowState {
    UNAUTHENTICATED,
    REDIRECT_ISSUED,
    CALLBACK_PENDING,
    AUTHENTICATED,
    AUTH_FAILED;

    /**
     * Returns whether moving from this state to {@code next} is a legal transition.
     */
    public boolean canTransitionTo(OidcFlowState next) {
        return allowedTargets().contains(next);
    }

    private Set<OidcFlowState> allowedTargets() {
        return switch (this) {
            case UNAUTHENTICATED -> EnumSet.of(REDIRECT_ISSUED);
            case REDIRECT_ISSUED -> EnumSet.of(CALLBACK_PENDING, AUTH_FAILED);
            case CALLBACK_PENDING -> EnumSet.of(AUTHENTICATED, AUTH_FAILED);
            case AUTHENTICATED -> EnumSet.of(UNAUTHENTICATED);
            case AUTH_FAILED -> EnumSet.noneOf(OidcFlowState.class);
        };
    }
}
