package vpnmanager.core.service.profile;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.model.certificate.IssuanceAuthorization;
import vpnmanager.core.model.certificate.IssuanceRequest;
import vpnmanager.core.model.profile.ProfileArtifact;
import vpnmanager.core.model.profile.ProfileOptions;
import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.CertificateManagement;
import vpnmanager.core.port.in.ProfileIssuance;
import vpnmanager.core.service.certificate.SubjectValidator;

/**
 * Builds downloadable profiles on top of certificate issuance.
 */
@ApplicationScoped
public class ProfileService implements ProfileIssuance {

    private static final Logger LOG = Logger.getLogger(ProfileService.class);

    private final CertificateManagement certificates;
    private final TemplateResolver templates;

    @Inject
    public ProfileService(CertificateManagement certificates, TemplateResolver templates) {
        this.certificates = certificates;
        this.templates = templates;
    }

    @Override
    public Uni<ProfileArtifact> userProfile(Session session, ProfileOptions options) {
        final var effective = options == null ? ProfileOptions.defaults() : options;
        final var template = templates.forGroups(session.groups());
        final int port = effective.customPort().orElse(template.port());
        if (port < 1 || port > 65535) {
            return Uni.createFrom().failure(ValidationException.malformed("custom_port", "Port must be 1-65535"));
        }
        final var protocol = effective.useTcp() ? "tcp" : template.protocol();
        final var commonName = commonNameFor(session);
        final var email = isPlausibleEmail(session.email()) ? session.email() : null;

        return certificates
                .issue(
                        new IssuanceRequest(CertificateType.CLIENT, commonName, email),
                        IssuanceAuthorization.ofSession(session))
                .map(issued -> {
                    LOG.debugf("Rendering %s profile for %s via %s", protocol, session.subject(), template.name());
                    final var content = OvpnRenderer.clientProfile(template, issued, protocol, port);
                    return new ProfileArtifact(
                            fileNameFor(commonName) + ".ovpn",
                            ProfileArtifact.OVPN_CONTENT_TYPE,
                            content.getBytes(StandardCharsets.UTF_8),
                            issued.certificate().fingerprint());
                });
    }

    @Override
    public Uni<ProfileArtifact> serverBundle(Psk psk) {
        final var template = templates.byName(psk.templateSet());
        return certificates
                .issue(
                        new IssuanceRequest(CertificateType.SERVER, psk.description(), null),
                        IssuanceAuthorization.ofPsk(psk))
                .map(issued -> new ProfileArtifact(
                        fileNameFor(psk.description()) + "-server.zip",
                        ProfileArtifact.ZIP_CONTENT_TYPE,
                        OvpnRenderer.serverBundle(template, issued),
                        issued.certificate().fingerprint()));
    }

    @Override
    public Uni<ProfileArtifact> computerProfile(Psk psk) {
        final var template = templates.byName(psk.templateSet());
        return certificates
                .issue(
                        new IssuanceRequest(CertificateType.COMPUTER, psk.description(), null),
                        IssuanceAuthorization.ofPsk(psk))
                .map(issued -> new ProfileArtifact(
                        fileNameFor(psk.description()) + ".ovpn",
                        ProfileArtifact.OVPN_CONTENT_TYPE,
                        OvpnRenderer.clientProfile(template, issued, template.protocol(), template.port())
                                .getBytes(StandardCharsets.UTF_8),
                        issued.certificate().fingerprint()));
    }

    /**
     * Email when it fits a common name, otherwise the subject with unsupported characters replaced.
     */
    static String commonNameFor(Session session) {
        if (isPlausibleEmail(session.email())
                && SubjectValidator.validateCommonName(session.email()).isValid()) {
            return session.email();
        }
        var cn = session.subject().replaceAll("[^A-Za-z0-9 ._@-]", "-");
        if (cn.isEmpty() || !Character.isLetterOrDigit(cn.charAt(0))) {
            cn = "u" + cn;
        }
        return cn.length() > SubjectValidator.MAX_COMMON_NAME_LENGTH
                ? cn.substring(0, SubjectValidator.MAX_COMMON_NAME_LENGTH)
                : cn;
    }

    private static boolean isPlausibleEmail(String email) {
        return email != null && SubjectValidator.validateEmail(email).isValid() && !email.isBlank();
    }

    private static String fileNameFor(String commonName) {
        return commonName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "_");
    }
}
