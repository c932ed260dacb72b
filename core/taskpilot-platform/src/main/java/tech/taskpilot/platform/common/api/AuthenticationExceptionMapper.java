package tech.taskpilot.platform.common.api;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.taskpilot.platform.common.errors.AuthenticationException;

/**
 * Renders bearer authentication failures as 401 with a Bearer challenge.
 *
 * <pre>
 * { "error": "Invalid or expired session", "code": "UNAUTHORIZED" }
 * </pre>
 */
@Provider
public class AuthenticationExceptionMapper implements ExceptionMapper<AuthenticationException> {

    @Override
    public Response toResponse(AuthenticationException exception) {
        return Response.status(Response.Status.UNAUTHORIZED)
            .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.ErrorResponse(exception.getMessage(), "UNAUTHORIZED"))
            .build();
    }
}
