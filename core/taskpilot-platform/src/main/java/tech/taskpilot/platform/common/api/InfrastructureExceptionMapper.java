package tech.taskpilot.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.common.errors.InfrastructureException;

/**
 * Logs the full failure and returns a generic body. Retryable failures map to 503
 * so callers know the request can be repeated.
 */
@Provider
public class InfrastructureExceptionMapper implements ExceptionMapper<InfrastructureException> {

    private static final Logger LOG = Logger.getLogger(InfrastructureExceptionMapper.class);

    @Override
    public Response toResponse(InfrastructureException exception) {
        LOG.errorf(exception, "Infrastructure failure: %s", exception.getMessage());
        Response.Status status = exception.isRetryable()
            ? Response.Status.SERVICE_UNAVAILABLE
            : Response.Status.INTERNAL_SERVER_ERROR;
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.ErrorResponse("Internal server error", "INTERNAL_ERROR"))
            .build();
    }
}
