package vpnmanager.core.service.auth;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates the random values the login and session machinery depends on.
 *
 * <p>All values are drawn from {@link SecureRandom} and encoded as URL-safe
 * Base64 without padding unless stated otherwise.
 */
@ApplicationScoped
public class SecureTokenGenerator {

    private static final int SESSION_ID_BYTES = 32; // 256 bits
    private static final int STATE_BYTES = 32;
    private static final int NONCE_BYTES = 32;
    private static final int SECRET_BYTES = 32;
    private static final int SHORT_ID_BYTES = 4;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * @return A session ID (43 characters)
     */
    public String sessionId() {
        return random(SESSION_ID_BYTES);
    }

    /**
     * @return An OAuth state value (43 characters)
     */
    public String state() {
        return random(STATE_BYTES);
    }

    /**
     * @return An OIDC nonce (43 characters)
     */
    public String nonce() {
        return random(NONCE_BYTES);
    }

    /**
     * @return A secret suitable as an HMAC key or pre-shared key (43 characters)
     */
    public String secret() {
        return random(SECRET_BYTES);
    }

    /**
     * @return An 8 character hex identifier for display and revocation
     */
    public String shortId() {
        byte[] bytes = new byte[SHORT_ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private String random(int length) {
        byte[] bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
