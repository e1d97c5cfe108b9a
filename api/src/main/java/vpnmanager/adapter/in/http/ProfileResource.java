package vpnmanager.adapter.in.http;

import java.util.OptionalInt;

import jakarta.inject.Inject;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import vpnmanager.adapter.in.auth.RequestGuard;
import vpnmanager.adapter.in.dto.CertificateDto;
import vpnmanager.adapter.in.dto.PageDto;
import vpnmanager.adapter.in.validation.PaginationParser;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.model.profile.ProfileOptions;
import vpnmanager.core.port.in.CertificateManagement;
import vpnmanager.core.port.in.ProfileIssuance;
import vpnmanager.core.port.in.TransparencyLogQuery;

/**
 * Self-service endpoints for a signed-in user: own certificates and profile download.
 *
 * <p>State-changing requests carry the CSRF token as the {@code csrf_token} form field
 * or the configured header.
 */
@Path("/profile")
@Produces(MediaType.APPLICATION_JSON)
public class ProfileResource {

    private final RequestGuard guard;
    private final CertificateManagement certificates;
    private final TransparencyLogQuery transparency;
    private final ProfileIssuance profiles;

    @Inject
    public ProfileResource(
            RequestGuard guard,
            CertificateManagement certificates,
            TransparencyLogQuery transparency,
            ProfileIssuance profiles) {
        this.guard = guard;
        this.certificates = certificates;
        this.transparency = transparency;
        this.profiles = profiles;
    }

    @GET
    @Path("/certificates")
    public Uni<PageDto<CertificateDto>> listCertificates(
            @Context HttpServerRequest request, @QueryParam("page") String page, @QueryParam("limit") String limit) {
        return guard.requireSession(request, Action.VIEW_OWN_CERTIFICATES)
                .flatMap(session -> transparency.listOwn(
                        session, PaginationParser.page(page), PaginationParser.size(limit)))
                .map(result -> PageDto.fromModel(result, CertificateDto::fromModel));
    }

    @GET
    @Path("/certificates/{fingerprint}")
    public Uni<CertificateDto> getCertificate(
            @Context HttpServerRequest request, @PathParam("fingerprint") String fingerprint) {
        return guard.requireSession(request)
                .flatMap(session -> certificates.get(fingerprint, session))
                .map(CertificateDto::fromModel);
    }

    @POST
    @Path("/certificates/{fingerprint}/revoke")
    public Uni<CertificateDto> revokeCertificate(
            @Context HttpServerRequest request,
            @PathParam("fingerprint") String fingerprint,
            @FormParam("reason") String reason,
            @FormParam("csrf_token") String csrfToken) {
        return guard.requireMutation(request, csrfToken)
                .flatMap(session -> certificates.revoke(fingerprint, RevocationReason.fromInput(reason), session))
                .map(CertificateDto::fromModel);
    }

    /**
     * Issues a client certificate and returns it as an OpenVPN profile.
     */
    @POST
    @Path("/config")
    @Produces({"application/x-openvpn-profile", MediaType.APPLICATION_JSON})
    public Uni<Response> downloadConfig(
            @Context HttpServerRequest request,
            @FormParam("use_tcp") String useTcp,
            @FormParam("custom_port") String customPort,
            @FormParam("csrf_token") String csrfToken) {
        return guard.requireMutation(request, csrfToken, Action.ISSUE_CLIENT_CERTIFICATE)
                .flatMap(session -> profiles.userProfile(session, options(useTcp, customPort)))
                .map(Downloads::attachment);
    }

    static ProfileOptions options(String useTcp, String customPort) {
        final boolean tcp = useTcp != null
                && ("on".equalsIgnoreCase(useTcp) || "true".equalsIgnoreCase(useTcp) || "1".equals(useTcp));
        if (customPort == null || customPort.isBlank()) {
            return new ProfileOptions(tcp, OptionalInt.empty());
        }
        try {
            return new ProfileOptions(tcp, OptionalInt.of(Integer.parseInt(customPort.trim())));
        } catch (NumberFormatException e) {
            throw ValidationException.malformed("custom_port", "Port must be a number between 1 and 65535");
        }
    }
}
