package tech.taskpilot.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.taskpilot.platform.common.errors.ClientRegistrationException;

@Provider
public class ClientRegistrationExceptionMapper implements ExceptionMapper<ClientRegistrationException> {

    @Override
    public Response toResponse(ClientRegistrationException exception) {
        return Response.status(exception.getStatus())
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.OAuthErrorResponse(exception.getErrorCode(), exception.getMessage()))
            .build();
    }
}
