package vpnmanager.core.model.auth;

/**
 * Result of an authorization check.
 *
 * <p>Decisions are computed per request and never cached.
 */
public sealed interface AccessDecision {

    record Allow() implements AccessDecision {}

    record Deny(DenyReason reason) implements AccessDecision {}

    default boolean isAllowed() {
        return this instanceof Allow;
    }

    static AccessDecision allow() {
        return new Allow();
    }

    static AccessDecision deny(DenyReason reason) {
        return new Deny(reason);
    }
}
