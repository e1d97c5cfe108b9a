package vpnmanager.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
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
import vpnmanager.adapter.in.validation.PaginationParser;
import vpnmanager.adapter.in.validation.QueryFilters;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.port.in.TransparencyLogQuery;

/**
 * Certificate transparency view. Admins see every certificate, other users their own.
 */
@Path("/certificates")
@Produces(MediaType.APPLICATION_JSON)
public class TransparencyResource {

    private final RequestGuard guard;
    private final TransparencyLogQuery transparency;

    @Inject
    public TransparencyResource(RequestGuard guard, TransparencyLogQuery transparency) {
        this.guard = guard;
        this.transparency = transparency;
    }

    @GET
    public Uni<CertificateSearchDto> list(
            @Context HttpServerRequest request,
            @QueryParam("type") String type,
            @QueryParam("subject") String subject,
            @QueryParam("from_date") String fromDate,
            @QueryParam("to_date") String toDate,
            @QueryParam("include_revoked") String includeRevoked,
            @QueryParam("page") String page,
            @QueryParam("limit") String limit) {
        return guard.requireSession(request, Action.VIEW_TRANSPARENCY_LOG).flatMap(session -> {
            final var filter = QueryFilters.certificateFilter(type, subject, fromDate, toDate, includeRevoked);
            return transparency
                    .search(filter, PaginationParser.page(page), PaginationParser.size(limit), session)
                    .map(result -> AdminCertificateResource.toSearchDto(
                            filter, PageDto.fromModel(result, CertificateDto::fromModel)));
        });
    }
}
