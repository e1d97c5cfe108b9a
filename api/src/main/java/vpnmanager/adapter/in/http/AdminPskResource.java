package vpnmanager.adapter.in.http;

import java.time.Duration;
import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import vpnmanager.adapter.in.auth.RequestGuard;
import vpnmanager.adapter.in.dto.PskCreatedDto;
import vpnmanager.adapter.in.dto.PskDto;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.psk.PskType;
import vpnmanager.core.port.in.PskManagement;

/**
 * Admin endpoints for pre-shared keys.
 *
 * <p>The plaintext key is only returned in the response to the create request.
 * Only its hash is stored.
 */
@Path("/admin/psk")
@Produces(MediaType.APPLICATION_JSON)
public class AdminPskResource {

    private static final int MAX_TTL_DAYS = 36500;

    private final RequestGuard guard;
    private final PskManagement psks;

    @Inject
    public AdminPskResource(RequestGuard guard, PskManagement psks) {
        this.guard = guard;
        this.psks = psks;
    }

    @GET
    public Uni<List<PskDto>> list(@Context HttpServerRequest request) {
        return guard.requireSession(request, Action.MANAGE_PSK)
                .flatMap(psks::list)
                .map(all -> all.stream().map(PskDto::fromModel).toList());
    }

    @POST
    public Uni<Response> create(
            @Context HttpServerRequest request,
            @FormParam("description") String description,
            @FormParam("psk_type") String type,
            @FormParam("template_set") String templateSet,
            @FormParam("ttl_days") String ttlDays,
            @FormParam("csrf_token") String csrfToken) {
        return guard.requireMutation(request, csrfToken, Action.MANAGE_PSK)
                .flatMap(admin -> psks.create(description, pskType(type), templateSet, ttl(ttlDays), admin))
                .map(result -> Response.status(Response.Status.CREATED)
                        .entity(PskCreatedDto.fromModel(result))
                        .build());
    }

    @GET
    @Path("/{id}")
    public Uni<PskDto> get(@Context HttpServerRequest request, @PathParam("id") String id) {
        return guard.requireSession(request, Action.MANAGE_PSK)
                .flatMap(admin -> psks.get(id, admin))
                .map(PskDto::fromModel);
    }

    /**
     * Revoked keys can no longer mint certificates. The record is kept for audit.
     */
    @POST
    @Path("/{id}/revoke")
    public Uni<PskDto> revoke(
            @Context HttpServerRequest request,
            @PathParam("id") String id,
            @FormParam("csrf_token") String csrfToken) {
        return guard.requireMutation(request, csrfToken, Action.MANAGE_PSK)
                .flatMap(admin -> psks.revoke(id, admin))
                .map(PskDto::fromModel);
    }

    static PskType pskType(String raw) {
        return PskType.parse(raw)
                .orElseThrow(() -> ValidationException.malformed("psk_type", "PSK type must be server or computer"));
    }

    /**
     * @return the TTL, or null for a key that never expires
     */
    static Duration ttl(String ttlDays) {
        if (ttlDays == null || ttlDays.isBlank()) {
            return null;
        }
        final int days;
        try {
            days = Integer.parseInt(ttlDays.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.malformed("ttl_days", "TTL must be a whole number of days");
        }
        if (days < 1 || days > MAX_TTL_DAYS) {
            throw ValidationException.malformed("ttl_days", "TTL must be between 1 and %d days".formatted(MAX_TTL_DAYS));
        }
        return Duration.ofDays(days);
    }
}
