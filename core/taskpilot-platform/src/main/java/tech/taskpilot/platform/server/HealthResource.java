package tech.taskpilot.platform.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;

@Path("/health")
@Tag(name = "Health", description = "Liveness and readiness probes")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    private static final Logger LOG = Logger.getLogger(HealthResource.class);

    @Inject
    ServerConfig serverConfig;

    @Inject
    EntityManager em;

    @Inject
    AuthConfig authConfig;

    @GET
    @Operation(summary = "Basic health check")
    public HealthResponse health() {
        return new HealthResponse("healthy", serverConfig.version(), null);
    }

    @GET
    @Path("/live")
    @Operation(summary = "Liveness probe")
    public HealthResponse live() {
        return new HealthResponse("alive", serverConfig.version(), null);
    }

    @GET
    @Path("/ready")
    @Operation(summary = "Readiness probe", description = "Ready when the database answers")
    public Response ready() {
        ComponentStatus database = checkDatabase();
        String status = database.healthy() ? "ready" : "not ready";
        return Response.status(database.healthy() ? 200 : 503)
            .entity(new HealthResponse(status, serverConfig.version(), Map.of("database", database)))
            .build();
    }

    @GET
    @Path("/detailed")
    @Operation(summary = "Component health", description = "Database connectivity and OAuth configuration")
    public Response detailed() {
        Map<String, ComponentStatus> components = new LinkedHashMap<>();
        components.put("database", checkDatabase());
        components.put("configuration", checkConfiguration());

        boolean healthy = components.values().stream().allMatch(ComponentStatus::healthy);
        return Response.status(healthy ? 200 : 503)
            .entity(new HealthResponse(healthy ? "healthy" : "degraded", serverConfig.version(), components))
            .build();
    }

    ComponentStatus checkDatabase() {
        long start = System.nanoTime();
        try {
            em.createNativeQuery("SELECT 1").getSingleResult();
            return new ComponentStatus("healthy", (System.nanoTime() - start) / 1_000_000, null);
        } catch (PersistenceException e) {
            LOG.warnf(e, "Database health check failed");
            return new ComponentStatus("unhealthy", null, "Database unreachable");
        }
    }

    ComponentStatus checkConfiguration() {
        AuthConfig.GoogleConfig google = authConfig.google();
        if (google.clientId().isBlank() || google.clientSecret().isBlank()) {
            return new ComponentStatus("unhealthy", null, "Google OAuth client is not configured");
        }
        try {
            URI callback = new URI(google.redirectUri());
            if (callback.getScheme() == null || callback.getHost() == null) {
                return new ComponentStatus("unhealthy", null, "OAuth redirect URI must be absolute");
            }
        } catch (URISyntaxException e) {
            return new ComponentStatus("unhealthy", null, "OAuth redirect URI is malformed");
        }
        return new ComponentStatus("healthy", null, null);
    }

    public record HealthResponse(String status, String version, Map<String, ComponentStatus> components) {}

    public record ComponentStatus(
        String status,
        @JsonProperty("latency_ms") Long latencyMs,
        String message
    ) {
        boolean healthy() {
            return "healthy".equals(status);
        }
    }
}
