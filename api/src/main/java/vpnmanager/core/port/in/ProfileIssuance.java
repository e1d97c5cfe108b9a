package vpnmanager.core.port.in;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.profile.ProfileArtifact;
import vpnmanager.core.model.profile.ProfileOptions;
import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.model.session.Session;

/**
 * Inbound port for producing downloadable OpenVPN profiles and bundles.
 *
 * <p>Each call issues a fresh certificate.
 */
public interface ProfileIssuance {

    Uni<ProfileArtifact> userProfile(Session session, ProfileOptions options);

    Uni<ProfileArtifact> serverBundle(Psk psk);

    Uni<ProfileArtifact> computerProfile(Psk psk);
}
