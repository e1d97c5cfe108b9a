package vpnmanager.adapter.in.http;

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

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import vpnmanager.adapter.in.auth.RequestGuard;
import vpnmanager.adapter.in.dto.CertificateDto;
import vpnmanager.adapter.in.dto.CertificateSearchDto;
import vpnmanager.adapter.in.dto.PageDto;
import vpnmanager.adapter.in.dto.TransparencyEventDto;
import vpnmanager.adapter.in.validation.HtmlEscaper;
import vpnmanager.adapter.in.validation.PaginationParser;
import vpnmanager.adapter.in.validation.QueryFilters;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.port.in.CertificateManagement;
import vpnmanager.core.port.in.TransparencyLogQuery;

/**
 * Admin certificate search, detail, revocation and the raw transparency log.
 */
@Path("/admin/certificates")
@Produces(MediaType.APPLICATION_JSON)
public class AdminCertificateResource {

    private final RequestGuard guard;
    private final CertificateManagement certificates;
    private final TransparencyLogQuery transparency;

    @Inject
    public AdminCertificateResource(
            RequestGuard guard, CertificateManagement certificates, TransparencyLogQuery transparency) {
        this.guard = guard;
        this.certificates = certificates;
        this.transparency = transparency;
    }

    @GET
    public Uni<CertificateSearchDto> search(
            @Context HttpServerRequest request,
            @QueryParam("type") String type,
            @QueryParam("subject") String subject,
            @QueryParam("from_date") String fromDate,
            @QueryParam("to_date") String toDate,
            @QueryParam("include_revoked") String includeRevoked,
            @QueryParam("page") String page,
            @QueryParam("limit") String limit) {
        return guard.requireSession(request, Action.SEARCH_ALL_CERTIFICATES).flatMap(admin -> {
            final var filter = QueryFilters.certificateFilter(type, subject, fromDate, toDate, includeRevoked);
            return transparency
                    .search(filter, PaginationParser.page(page), PaginationParser.size(limit), admin)
                    .map(result -> toSearchDto(filter, PageDto.fromModel(result, CertificateDto::fromModel)));
        });
    }

    @GET
    @Path("/events")
    public Uni<PageDto<TransparencyEventDto>> events(
            @Context HttpServerRequest request, @QueryParam("page") String page, @QueryParam("limit") String limit) {
        return guard.requireSession(request, Action.SEARCH_ALL_CERTIFICATES)
                .flatMap(admin -> transparency.events(PaginationParser.page(page), PaginationParser.size(limit), admin))
                .map(result -> PageDto.fromModel(result, TransparencyEventDto::fromModel));
    }

    @GET
    @Path("/{fingerprint}")
    public Uni<CertificateDto> get(@Context HttpServerRequest request, @PathParam("fingerprint") String fingerprint) {
        return guard.requireSession(request, Action.ADMIN_PAGE)
                .flatMap(admin -> certificates.get(fingerprint, admin))
                .map(CertificateDto::fromModel);
    }

    @POST
    @Path("/{fingerprint}/revoke")
    public Uni<CertificateDto> revoke(
            @Context HttpServerRequest request,
            @PathParam("fingerprint") String fingerprint,
            @FormParam("reason") String reason,
            @FormParam("csrf_token") String csrfToken) {
        return guard.requireMutation(request, csrfToken, Action.ADMIN_PAGE)
                .flatMap(admin -> certificates.revoke(fingerprint, RevocationReason.fromInput(reason), admin))
                .map(CertificateDto::fromModel);
    }

    static CertificateSearchDto toSearchDto(CertificateFilter filter, PageDto<CertificateDto> results) {
        return new CertificateSearchDto(
                filter.subjectContains().map(HtmlEscaper::escape).orElse(null),
                filter.type().map(CertificateType::wireName).orElse(null),
                filter.includeRevoked(),
                results);
    }
}
