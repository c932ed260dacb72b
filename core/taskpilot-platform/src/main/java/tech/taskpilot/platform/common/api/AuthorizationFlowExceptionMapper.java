package tech.taskpilot.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.common.errors.AuthorizationFlowException;

@Provider
public class AuthorizationFlowExceptionMapper implements ExceptionMapper<AuthorizationFlowException> {

    private static final Logger LOG = Logger.getLogger(AuthorizationFlowExceptionMapper.class);

    @Override
    public Response toResponse(AuthorizationFlowException exception) {
        LOG.warnf("Authorization flow failed [%s]: %s", exception.getErrorCode(), exception.getMessage());
        return Response.status(exception.getStatus())
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.OAuthErrorResponse(exception.getErrorCode(), exception.getMessage()))
            .build();
    }
}
