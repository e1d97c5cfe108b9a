package vpnmanager.core.model.certificate;

import java.util.Optional;

import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.model.session.Session;

/**
 * Credentials presented with an issuance request. Exactly one of session or PSK must be set.
 */
public record IssuanceAuthorization(Optional<Session> session, Optional<Psk> psk) {

    public IssuanceAuthorization {
        session = session == null ? Optional.empty() : session;
        psk = psk == null ? Optional.empty() : psk;
    }

    public static IssuanceAuthorization ofSession(Session session) {
        return new IssuanceAuthorization(Optional.of(session), Optional.empty());
    }

    public static IssuanceAuthorization ofPsk(Psk psk) {
        return new IssuanceAuthorization(Optional.empty(), Optional.of(psk));
    }

    /**
     * Stable identifier of whoever is asking, used for logging and duplicate detection.
     */
    public String principal() {
        if (session.isPresent()) {
            return "user:" + session.get().subject();
        }
        return psk.map(p -> "psk:" + p.id()).orElse("anonymous");
    }
}
