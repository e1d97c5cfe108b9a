package vpnmanager.core.model.auth;

import java.util.List;
import java.util.Objects;

/**
 * Verified claims extracted from an ID token.
 *
 * @param subject the {@code sub} claim
 * @param nonce the {@code nonce} claim, may be null if the provider omitted it
 * @param displayName best available human-readable name
 * @param email the {@code email} claim, may be null
 * @param groups group memberships from the configured groups claim
 */
public record IdTokenClaims(String subject, String nonce, String displayName, String email, List<String> groups) {

    public IdTokenClaims {
        Objects.requireNonNull(subject, "subject");
        groups = groups == null ? List.of() : List.copyOf(groups);
        if (displayName == null || displayName.isBlank()) {
            displayName = subject;
        }
    }
}
