package vpnmanager.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import vpnmanager.core.exception.CsrfException;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.out.SecurityMetrics;
import vpnmanager.core.util.SecureHash;

/**
 * Derives and verifies double-submit CSRF tokens.
 *
 * <p>The token is {@code BASE64URL(HMAC-SHA256(csrfSecret, "csrf:" + sessionId))}.
 * It is never stored and stays the same for the whole session, so any number of
 * tabs can submit forms concurrently.
 */
@ApplicationScoped
public class CsrfTokenService {

    private static final Logger LOG = Logger.getLogger(CsrfTokenService.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int MAX_TOKEN_LENGTH = 128;

    private final SecurityMetrics metrics;

    @Inject
    public CsrfTokenService(SecurityMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Returns the CSRF token bound to a session.
     */
    public String tokenFor(Session session) {
        try {
            final var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(session.csrfSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            final var tag = mac.doFinal(("csrf:" + session.id()).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(tag);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    /**
     * Verifies a submitted token against the session.
     *
     * @param session the authenticated session
     * @param presented token from the form field or header, may be null
     * @throws CsrfException if the token is missing or does not match
     */
    public void verify(Session session, String presented) {
        if (presented == null || presented.isBlank()) {
            throw reject(session, CsrfException.Reason.MISSING_TOKEN);
        }
        if (presented.length() > MAX_TOKEN_LENGTH || !SecureHash.constantTimeEquals(tokenFor(session), presented)) {
            throw reject(session, CsrfException.Reason.TOKEN_MISMATCH);
        }
    }

    private CsrfException reject(Session session, CsrfException.Reason reason) {
        LOG.warnf("CSRF check failed (%s) for subject %s", reason, session.subject());
        metrics.recordCsrfRejection(reason.name().toLowerCase());
        return new CsrfException(reason);
    }
}
