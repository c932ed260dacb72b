package tech.taskpilot.platform.common.api;

import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.QueryTimeoutException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Store failures that escape a repository. Timeouts are retryable (503),
 * everything else is a plain 500. Internal detail stays in the log.
 */
@Provider
public class PersistenceExceptionMapper implements ExceptionMapper<PersistenceException> {

    private static final Logger LOG = Logger.getLogger(PersistenceExceptionMapper.class);

    @Override
    public Response toResponse(PersistenceException exception) {
        boolean timeout = exception instanceof QueryTimeoutException
            || exception instanceof LockTimeoutException;
        LOG.errorf(exception, "Store operation failed (timeout=%s)", timeout);
        return Response.status(timeout ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.ErrorResponse(
                timeout ? "Store temporarily unavailable" : "Internal server error",
                timeout ? "STORE_UNAVAILABLE" : "INTERNAL_ERROR"))
            .build();
    }
}
