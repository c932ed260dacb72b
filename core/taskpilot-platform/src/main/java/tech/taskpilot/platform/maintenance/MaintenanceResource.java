package tech.taskpilot.platform.maintenance;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.client.ClientRegistrationService;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.common.errors.AuthenticationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Removes expired sessions and dynamic clients on demand, for an external
 * scheduler. Disabled unless {@code taskpilot.maintenance.token} is set.
 */
@Path("/maintenance")
@Tag(name = "Maintenance", description = "Expiry sweeps")
@Produces(MediaType.APPLICATION_JSON)
public class MaintenanceResource {

    private static final Logger LOG = Logger.getLogger(MaintenanceResource.class);

    static final String TOKEN_HEADER = "X-Maintenance-Token";

    @ConfigProperty(name = "taskpilot.maintenance.token")
    Optional<String> maintenanceToken;

    @Inject
    SessionService sessionService;

    @Inject
    ClientRegistrationService clientRegistrationService;

    @POST
    @Path("/sweep")
    @Operation(summary = "Delete expired sessions and client registrations")
    @APIResponse(responseCode = "200", description = "Sweep counts")
    @APIResponse(responseCode = "401", description = "Wrong maintenance token")
    @APIResponse(responseCode = "404", description = "Maintenance endpoint disabled")
    public SweepResponse sweep(@HeaderParam(TOKEN_HEADER) String token) {
        String expected = maintenanceToken.filter(t -> !t.isBlank()).orElseThrow(NotFoundException::new);
        if (token == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8))) {
            throw new AuthenticationException("Invalid maintenance token");
        }

        long sessions = sessionService.cleanupExpired();
        long clients = clientRegistrationService.cleanupExpired();
        LOG.infof("Maintenance sweep removed %d sessions and %d clients", sessions, clients);
        return new SweepResponse(sessions, clients);
    }

    public record SweepResponse(
        @JsonProperty("sessions_removed") long sessionsRemoved,
        @JsonProperty("clients_removed") long clientsRemoved
    ) {}
}
