package vpnmanager.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import vpnmanager.adapter.in.dto.HealthDto;
import vpnmanager.core.config.ServiceConfig;

/**
 * Liveness endpoint for load balancers. Served in every mode.
 */
@Path("/health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    private final ServiceConfig config;

    @Inject
    public HealthResource(ServiceConfig config) {
        this.config = config;
    }

    @GET
    public HealthDto health() {
        return new HealthDto("healthy", config.name(), config.mode().wireName());
    }
}
