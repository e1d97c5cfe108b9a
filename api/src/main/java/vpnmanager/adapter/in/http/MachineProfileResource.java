package vpnmanager.adapter.in.http;

import java.util.Locale;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.exception.PskException;
import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.model.psk.PskType;
import vpnmanager.core.port.in.ProfileIssuance;
import vpnmanager.core.port.in.PskManagement;

/**
 * Unattended provisioning for servers and managed computers, authenticated by a
 * pre-shared key sent as {@code Authorization: Bearer <key>}.
 */
@Path("/api/v1")
public class MachineProfileResource {

    private static final String BEARER_PREFIX = "bearer ";

    private final PskManagement psks;
    private final ProfileIssuance profiles;

    @Inject
    public MachineProfileResource(PskManagement psks, ProfileIssuance profiles) {
        this.psks = psks;
        this.profiles = profiles;
    }

    @GET
    @Path("/server/bundle")
    @Produces({"application/zip", MediaType.APPLICATION_JSON})
    public Uni<Response> serverBundle(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        return authenticate(authorization, PskType.SERVER)
                .flatMap(profiles::serverBundle)
                .map(Downloads::attachment);
    }

    @GET
    @Path("/computer/config")
    @Produces({"application/x-openvpn-profile", MediaType.APPLICATION_JSON})
    public Uni<Response> computerConfig(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        return authenticate(authorization, PskType.COMPUTER)
                .flatMap(profiles::computerProfile)
                .map(Downloads::attachment);
    }

    private Uni<Psk> authenticate(String authorization, PskType type) {
        final var candidate = bearerToken(authorization);
        if (candidate == null) {
            return Uni.createFrom().failure(new PskException(PskException.Reason.INVALID));
        }
        return psks.validate(candidate, type);
    }

    static String bearerToken(String authorization) {
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!authorization.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
            return null;
        }
        final var token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
